package io.github.drompincen.noject.runtime.outline;

public enum OutlineOperation {
    ADD_TASK("adding task to"),
    CHANGE_VALUE("changing value of task in"),
    DELETE_TASK("deleting task of"),
    INCREASE_LEVEL("increasing level of task in"),
    DECREASE_LEVEL("decreasing level of task in"),
    COMPLETE_TASK("completing task of"),
    UNCOMPLETE_TASK("uncompleting task of"),
    GET_TASKS("listing tasks of");

    private final String description;

    OutlineOperation(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
