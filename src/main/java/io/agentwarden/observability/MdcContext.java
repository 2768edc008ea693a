package io.agentwarden.observability;

import org.slf4j.MDC;

/** MDC keys carried by worker threads while they own a task. */
public final class MdcContext {

    private MdcContext() {
    }

    public static void setWorker(String workerId) {
        MDC.put("workerId", workerId);
    }

    public static void setTask(String workerId, String taskId, String taskType) {
        MDC.put("workerId", workerId);
        MDC.put("taskId", taskId);
        MDC.put("taskType", taskType);
    }

    public static void setUpdate(String updateId) {
        MDC.put("updateId", updateId);
    }

    public static void clearUpdate() {
        MDC.remove("updateId");
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("taskType");
        MDC.remove("updateId");
    }

    public static void clear() {
        clearTask();
        MDC.remove("workerId");
    }
}
