package io.github.drompincen.noject.runtime.outline;

import io.github.drompincen.noject.persistence.document.TaskDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a project's task rows (in any order) into outline order by following
 * {@code next} pointers from the project's first task.
 *
 * <p>Rows are swapped into a growing prefix of a working array while an
 * id-to-slot map tracks where each row currently sits. The walk stops at a
 * tail ({@code next == null}), at an id that has no row, or when it comes back
 * to a row already placed. Rows the walk never reaches are left out.
 */
public final class OutlineLinearizer {

    private static final Logger log = LoggerFactory.getLogger(OutlineLinearizer.class);

    private OutlineLinearizer() {}

    public static List<TaskDocument> linearize(Collection<TaskDocument> tasks, Integer firstTask) {
        TaskDocument[] slots = tasks.toArray(new TaskDocument[0]);
        Map<Integer, Integer> slotById = new HashMap<>(slots.length * 2);
        for (int i = 0; i < slots.length; i++) {
            slotById.put(slots[i].getTaskId(), i);
        }

        int filled = 0;
        Integer currentId = firstTask;
        while (currentId != null) {
            Integer slot = slotById.get(currentId);
            if (slot == null) {
                if (slots.length > 0) {
                    log.warn("Task chain points at missing task {}", currentId);
                }
                break;
            }
            if (slot < filled) {
                log.warn("Task chain loops back to task {} after {} tasks", currentId, filled);
                break;
            }
            if (slot != filled) {
                TaskDocument displaced = slots[filled];
                slots[filled] = slots[slot];
                slots[slot] = displaced;
                slotById.put(displaced.getTaskId(), slot);
                slotById.put(currentId, filled);
            }
            currentId = slots[filled].getNext();
            filled++;
        }

        if (filled < slots.length) {
            log.warn("{} of {} tasks are not reachable from first task {}", slots.length - filled, slots.length, firstTask);
        }
        return new ArrayList<>(Arrays.asList(slots).subList(0, filled));
    }
}
