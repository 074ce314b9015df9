package com.coordinator.core.notification;

import java.util.Arrays;
import java.util.List;

/**
 * Kinds of operator notification. Wire names are what producers push onto the pending list;
 * older producers used the aliases. Anything unrecognised is {@link #GENERIC} and is still delivered.
 */
public enum NotificationType {
    SYSTEM("system", "system_notification"),
    NEW_TASK("new_task", "new_prp"),
    AGENT_DOWN("agent_down"),
    BULK_ENQUEUE("bulk_enqueue", "bulk_prps_queued"),
    DEPLOYMENT_FAILED("deployment_failed"),
    SCALING_NEEDED("scaling_needed"),
    PROGRESS_REPORT("progress_report"),
    QA_HANDLED("qa_handled"),
    GENERIC("generic");

    private final String wireName;
    private final List<String> aliases;

    NotificationType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public static NotificationType fromWireName(String name) {
        if (name == null) {
            return GENERIC;
        }
        return Arrays.stream(values())
            .filter(t -> t.wireName.equalsIgnoreCase(name) || t.aliases.contains(name.toLowerCase()))
            .findFirst()
            .orElse(GENERIC);
    }
}
