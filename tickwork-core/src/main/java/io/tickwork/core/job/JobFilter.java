package io.tickwork.core.job;

public record JobFilter(String groupId, Boolean enabled) {

    public static JobFilter all() {
        return new JobFilter(null, null);
    }

    public static JobFilter group(String groupId) {
        return new JobFilter(groupId, null);
    }

    public static JobFilter enabled(boolean enabled) {
        return new JobFilter(null, enabled);
    }

    public JobFilter withEnabled(boolean value) {
        return new JobFilter(groupId, value);
    }

    boolean matches(Job job) {
        if (groupId != null && !groupId.equals(job.groupId())) {
            return false;
        }
        return enabled == null || enabled == job.enabled();
    }
}
