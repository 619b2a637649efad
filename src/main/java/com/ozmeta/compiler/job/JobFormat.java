package com.ozmeta.compiler.job;

/**
 * Orchestration artifact styles an emitter can ask for.
 */
public enum JobFormat {
    PG_CRON("sql"),
    SNOWFLAKE_TASK("sql"),
    AIRFLOW("py");

    private final String extension;

    JobFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
