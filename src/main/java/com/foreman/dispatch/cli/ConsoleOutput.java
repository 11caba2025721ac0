package com.foreman.dispatch.cli;

import com.foreman.core.events.ForemanEvent;
import com.foreman.core.model.Assignment;
import com.foreman.core.model.Report;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskStatus;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Foreman CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) FOREMAN v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [FOREMAN]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void assignment(Assignment a) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + a.agentId() + "]|@ " + a.taskId() + " (attempt " + a.attempt() + ") "
                        + truncate(a.description(), 60)));
    }

    public static void assignments(List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            info("No tasks dispatched.");
            return;
        }
        for (Assignment a : assignments) {
            assignment(a);
        }
    }

    public static void events(List<ForemanEvent> events) {
        for (ForemanEvent e : events) {
            String subject = e.taskId() == null ? "" : " " + e.taskId();
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "@|faint [EVENT]|@ " + e.eventType() + subject));
        }
    }

    public static void held(String phase) {
        error("Session is held in phase " + phase + " on blocked task(s); unblock them to continue");
    }

    public static void taskTable(List<Task> tasks) {
        if (tasks.isEmpty()) {
            info("No tasks.");
            return;
        }
        System.out.printf("  %-10s %-16s %-12s %-5s %-5s %s%n",
                "TASK", "ROLE", "STATUS", "PRIO", "RETRY", "DESCRIPTION");
        System.out.println("  " + "-".repeat(76));
        for (Task t : tasks) {
            String line = String.format("  %-10s %-16s %-12s %-5d %-5d %s",
                    t.id(), t.role().key(), t.status().key(), t.priority(), t.retryCount(),
                    truncate(t.description(), 30));
            System.out.println(CommandLine.Help.Ansi.AUTO.string(colorFor(t.status(), line)));
            if (t.status() == TaskStatus.BLOCKED && t.blockedReason() != null) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + t.blockedReason()));
            }
        }
    }

    public static void report(Report report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Progress Report|@ " + report.timestamp()));
        System.out.println("  Phase:           " + report.phase().key());
        System.out.println("  Completed tasks: " + report.completedTasks());
        Map<String, Object> payload = report.payload();
        Object agents = payload.get("active_agents");
        if (agents instanceof List<?> list) {
            System.out.println("  Active agents:   " + (list.isEmpty() ? "none" : list));
        }
        Object blockers = payload.get("blockers");
        if (blockers instanceof List<?> list && !list.isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(red),bold Blockers:|@"));
            for (Object b : list) {
                Map<?, ?> entry = (Map<?, ?>) b;
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "    @|fg(red) -|@ " + entry.get("task_id") + ": " + entry.get("reason")));
            }
        } else {
            System.out.println("  Blockers:        none");
        }
        Object priorities = payload.get("next_priorities");
        if (priorities instanceof List<?> list && !list.isEmpty()) {
            System.out.println("  Next priorities: " + list);
        }
        Object recommendations = payload.get("recommendations");
        if (recommendations instanceof List<?> list) {
            for (Object r : list) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|fg(yellow) *|@ " + r));
            }
        }
    }

    private static String colorFor(TaskStatus status, String line) {
        return switch (status) {
            case COMPLETED -> "@|fg(green) " + line + "|@";
            case BLOCKED -> "@|fg(red) " + line + "|@";
            case IN_PROGRESS -> "@|fg(cyan) " + line + "|@";
            case PENDING -> line;
        };
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String single = s.replace('\n', ' ');
        return single.length() <= max ? single : single.substring(0, max - 3) + "...";
    }
}
