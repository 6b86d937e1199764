package io.github.drompincen.noject.runtime.project;

import io.github.drompincen.noject.persistence.document.ProjectDocument;
import io.github.drompincen.noject.persistence.repository.ProjectRepository;
import io.github.drompincen.noject.persistence.repository.TaskRepository;
import io.github.drompincen.noject.runtime.lock.ProjectLockService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;

@Service
public class ProjectService {

    private static final Logger log = LoggerFactory.getLogger(ProjectService.class);
    private static final String HEX = "0123456789ABCDEF";

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final ProjectLockService lockService;
    private final TransactionTemplate transactionTemplate;
    private final Random random = new Random();

    public ProjectService(ProjectRepository projectRepository, TaskRepository taskRepository,
                          ProjectLockService lockService, PlatformTransactionManager transactionManager) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.lockService = lockService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public ProjectDocument create(String name, String createdBy) {
        ProjectDocument doc = new ProjectDocument();
        doc.setProjectId(UUID.randomUUID().toString());
        doc.setName(name);
        doc.setCreatedBy(createdBy);
        String background = randomBackground(random);
        doc.setBackgroundColor(background);
        doc.setColor(contrastColor(background));
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(Instant.now());
        ProjectDocument saved = projectRepository.save(doc);
        log.info("Created project {} '{}'", saved.getProjectId(), name);
        return saved;
    }

    public List<ProjectDocument> list(String createdBy) {
        return createdBy != null
                ? projectRepository.findByCreatedByOrderByUpdatedAtDesc(createdBy)
                : projectRepository.findAllByOrderByUpdatedAtDesc();
    }

    public Optional<ProjectDocument> find(String projectId) {
        return projectRepository.findById(projectId);
    }

    /** Renames the project under its outline lock. Empty when there is no such project. */
    public Optional<ProjectDocument> rename(String projectId, String name) {
        return lockService.withLock(projectId, () -> transactionTemplate.execute(status ->
                projectRepository.findById(projectId).map(doc -> {
                    doc.setName(name);
                    doc.setUpdatedAt(Instant.now());
                    ProjectDocument saved = projectRepository.save(doc);
                    log.info("Renamed project {} to '{}'", projectId, name);
                    return saved;
                })));
    }

    /** Deletes the project and its whole outline. Returns false when there was no such project. */
    public boolean delete(String projectId) {
        if (!projectRepository.existsById(projectId)) {
            return false;
        }
        long removedTasks = lockService.withLock(projectId, () -> transactionTemplate.execute(status -> {
            long removed = taskRepository.deleteByProjectId(projectId);
            projectRepository.deleteById(projectId);
            return removed;
        }));
        lockService.evict(projectId);
        log.info("Deleted project {} with {} tasks", projectId, removedTasks);
        return true;
    }

    static String randomBackground(Random random) {
        StringBuilder sb = new StringBuilder("#");
        for (int i = 0; i < 6; i++) {
            sb.append(HEX.charAt(random.nextInt(16)));
        }
        return sb.toString();
    }

    /** Black or white text, whichever reads better on the given background (YIQ brightness). */
    static String contrastColor(String background) {
        int red = Integer.parseInt(background.substring(1, 3), 16);
        int green = Integer.parseInt(background.substring(3, 5), 16);
        int blue = Integer.parseInt(background.substring(5, 7), 16);
        int yiq = (red * 299 + green * 587 + blue * 114) / 1000;
        return yiq >= 128 ? "#000" : "#FFF";
    }
}
