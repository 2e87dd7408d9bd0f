package com.todotrail.core.config;

import com.todotrail.core.model.Severity;
import com.todotrail.core.model.TodoField;
import com.todotrail.core.scope.ScopeMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "todotrail")
public class TodoTrailProperties {

    private String author = "system";
    private Storage storage = new Storage();
    private ScopeSettings scope = new ScopeSettings();
    private RollbackSettings rollback = new RollbackSettings();
    private Triggers triggers = new Triggers();
    private Citations citations = new Citations();

    public String getAuthor() { return author; }
    public void setAuthor(String author) { this.author = author; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public ScopeSettings getScope() { return scope; }
    public void setScope(ScopeSettings scope) { this.scope = scope; }
    public RollbackSettings getRollback() { return rollback; }
    public void setRollback(RollbackSettings rollback) { this.rollback = rollback; }
    public Triggers getTriggers() { return triggers; }
    public void setTriggers(Triggers triggers) { this.triggers = triggers; }
    public Citations getCitations() { return citations; }
    public void setCitations(Citations citations) { this.citations = citations; }

    public static class Storage {
        private String root = ".cursor/project-manager/features";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }

    public static class ScopeSettings {
        private ScopeMode mode = ScopeMode.WARN;

        public ScopeMode getMode() { return mode; }
        public void setMode(ScopeMode mode) { this.mode = mode; }
    }

    public static class RollbackSettings {
        private Severity blockingSeverity = Severity.HIGH;
        private Severity defaultFieldSeverity = Severity.MEDIUM;
        private Map<String, Severity> fieldSeverity = defaultFieldSeverities();

        public Severity getBlockingSeverity() { return blockingSeverity; }
        public void setBlockingSeverity(Severity blockingSeverity) { this.blockingSeverity = blockingSeverity; }
        public Severity getDefaultFieldSeverity() { return defaultFieldSeverity; }
        public void setDefaultFieldSeverity(Severity severity) { this.defaultFieldSeverity = severity; }
        public Map<String, Severity> getFieldSeverity() { return fieldSeverity; }
        public void setFieldSeverity(Map<String, Severity> fieldSeverity) { this.fieldSeverity = fieldSeverity; }

        /**
         * Severity of discarding a change to {@code field}. Keys match the field name
         * ignoring case and dashes, so {@code parent-id} and {@code parentId} are equivalent.
         */
        public Severity severityOf(TodoField field) {
            String wanted = normalize(field.fieldName());
            for (var entry : fieldSeverity.entrySet()) {
                if (normalize(entry.getKey()).equals(wanted)) {
                    return entry.getValue();
                }
            }
            return defaultFieldSeverity;
        }

        private static String normalize(String key) {
            return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        }

        private static Map<String, Severity> defaultFieldSeverities() {
            Map<String, Severity> defaults = new LinkedHashMap<>();
            defaults.put("status", Severity.HIGH);
            defaults.put("parentId", Severity.HIGH);
            defaults.put("title", Severity.MEDIUM);
            defaults.put("planningDocPath", Severity.MEDIUM);
            defaults.put("completedAt", Severity.MEDIUM);
            defaults.put("blockedBy", Severity.MEDIUM);
            defaults.put("blocks", Severity.MEDIUM);
            defaults.put("scope", Severity.MEDIUM);
            defaults.put("planningDocSection", Severity.LOW);
            defaults.put("description", Severity.LOW);
            defaults.put("tags", Severity.LOW);
            defaults.put("metadata", Severity.LOW);
            return defaults;
        }
    }

    public static class Triggers {
        private int defaultWindowHours = 24;

        public int getDefaultWindowHours() { return defaultWindowHours; }
        public void setDefaultWindowHours(int hours) { this.defaultWindowHours = hours; }
    }

    public static class Citations {
        /** Whether TodoService cites a todo's changes on its direct children. */
        private boolean propagate = true;

        public boolean isPropagate() { return propagate; }
        public void setPropagate(boolean propagate) { this.propagate = propagate; }
    }
}
