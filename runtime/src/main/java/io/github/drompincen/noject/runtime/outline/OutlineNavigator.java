package io.github.drompincen.noject.runtime.outline;

import io.github.drompincen.noject.persistence.document.TaskDocument;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree queries over a linearized outline. Parent/child relations are implied
 * by {@code level}: a task's parent is the nearest earlier task with a smaller
 * level, its subtree is the run of later tasks with a greater level.
 */
public final class OutlineNavigator {

    public static final int NO_PARENT = -1;

    private OutlineNavigator() {}

    public static int indexOf(List<TaskDocument> ordered, int taskId) {
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getTaskId() == taskId) {
                return i;
            }
        }
        return -1;
    }

    public static int parentIndex(List<TaskDocument> ordered, int index) {
        int level = ordered.get(index).getLevel();
        if (level == 0) {
            return NO_PARENT;
        }
        for (int i = index - 1; i >= 0; i--) {
            if (ordered.get(i).getLevel() < level) {
                return i;
            }
        }
        return NO_PARENT;
    }

    /** Direct children only; grandchildren are skipped. */
    public static List<TaskDocument> children(List<TaskDocument> ordered, int parentIndex) {
        int parentLevel = ordered.get(parentIndex).getLevel();
        List<TaskDocument> children = new ArrayList<>();
        for (int i = parentIndex + 1; i < ordered.size(); i++) {
            int level = ordered.get(i).getLevel();
            if (level <= parentLevel) {
                break;
            }
            if (level == parentLevel + 1) {
                children.add(ordered.get(i));
            }
        }
        return children;
    }

    /** Exclusive end of the descendant run that follows {@code index}. */
    public static int subtreeEnd(List<TaskDocument> ordered, int index) {
        int level = ordered.get(index).getLevel();
        int end = index + 1;
        while (end < ordered.size() && ordered.get(end).getLevel() > level) {
            end++;
        }
        return end;
    }

    public static int lastSubtaskOrSelf(List<TaskDocument> ordered, int index) {
        return subtreeEnd(ordered, index) - 1;
    }
}
