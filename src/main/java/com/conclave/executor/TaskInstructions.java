package com.conclave.executor;

import com.conclave.core.model.Task;

import java.util.List;

/**
 * Renders the task file handed to external executors.
 */
public final class TaskInstructions {

    public static final String DIRECTORY = ".conclave";
    public static final String FILE_NAME = "task.md";

    private TaskInstructions() {}

    public static String render(Task task, int attempt) {
        var sb = new StringBuilder();
        sb.append("# ").append(task.title()).append("\n\n");
        sb.append("- Task: ").append(task.id()).append('\n');
        sb.append("- Attempt: ").append(attempt).append('\n');
        sb.append("- Complexity: ").append(task.complexity()).append('\n');
        if (task.parentId() != null) {
            sb.append("- Part of: ").append(task.parentId()).append('\n');
        }
        sb.append("\n## Description\n\n").append(task.description()).append('\n');
        appendList(sb, "Target Files", task.targetFiles());
        appendList(sb, "Target Directories", task.targetDirectories());
        appendList(sb, "Components", task.components());
        appendList(sb, "Interfaces", task.interfaces());
        appendList(sb, "Data Models", task.dataModels());
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, List<String> values) {
        if (values.isEmpty()) return;
        sb.append("\n## ").append(heading).append("\n\n");
        for (String value : values) {
            sb.append("- `").append(value).append("`\n");
        }
    }
}
