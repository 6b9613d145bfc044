package com.sqconfig.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing sqconfig MDC keys, read by the log pattern.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setOperation(String operation) {
        MDC.put("operation", operation);
    }

    public static void setTask(String operation, String objectKey) {
        MDC.put("operation", operation);
        MDC.put("objectKey", objectKey);
    }

    public static void setObject(String operation, String objectType, String objectKey) {
        MDC.put("operation", operation);
        MDC.put("objectType", objectType);
        MDC.put("objectKey", objectKey);
    }

    public static void clear() {
        MDC.remove("operation");
        MDC.remove("objectType");
        MDC.remove("objectKey");
    }
}
