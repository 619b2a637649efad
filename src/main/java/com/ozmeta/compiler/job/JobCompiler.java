package com.ozmeta.compiler.job;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.ozmeta.compiler.emit.TemplateRenderer;
import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.model.output.ArtifactType;
import com.ozmeta.compiler.model.output.EmittedFile;
import com.ozmeta.compiler.model.physical.ProjectedJob;
import com.ozmeta.compiler.model.physical.ProjectedJobStep;

/**
 * Renders projected jobs as orchestration artifacts under {@code jobs/}.
 */
public class JobCompiler {

    private final TemplateRenderer templates;

    public JobCompiler(TemplateRenderer templates) {
        this.templates = templates;
    }

    public static String artifactPath(ProjectedJob job, JobFormat format) {
        return "jobs/" + job.getPhysicalName() + "." + format.getExtension();
    }

    public EmittedFile compile(ProjectedJob job, JobFormat format, String targetKey) {
        String contents;
        switch (format) {
            case PG_CRON:
                contents = pgCron(job);
                break;
            case SNOWFLAKE_TASK:
                contents = snowflakeTasks(job);
                break;
            case AIRFLOW:
                contents = airflow(job, targetKey);
                break;
            default:
                throw new IllegalArgumentException("Unsupported job format " + format);
        }
        return EmittedFile.builder()
                .path(artifactPath(job, format))
                .contents(contents)
                .type(ArtifactType.JOB)
                .build();
    }

    private String pgCron(ProjectedJob job) {
        String body = job.getSteps().stream()
                .map(s -> "    -- step " + s.getCode() + "\n    " + terminate(s.getCommand()))
                .collect(Collectors.joining("\n"));
        StringBuilder sb = new StringBuilder();
        sb.append("-- job ").append(job.getCode()).append(layerSuffix(job)).append("\n");
        if (job.getSchedule() == null) {
            sb.append("-- no schedule; run manually\n");
            sb.append(body).append("\n");
        } else {
            sb.append("SELECT cron.schedule(")
                    .append(SqlDialect.POSTGRES.stringLiteral(job.getPhysicalName())).append(", ")
                    .append(SqlDialect.POSTGRES.stringLiteral(job.getSchedule())).append(", $job$\n")
                    .append(body).append("\n$job$);\n");
        }
        return sb.toString();
    }

    private String snowflakeTasks(ProjectedJob job) {
        StringBuilder sb = new StringBuilder();
        sb.append("-- job ").append(job.getCode()).append(layerSuffix(job)).append("\n");
        for (ProjectedJobStep step : job.getSteps()) {
            String task = SqlDialect.SNOWFLAKE.quote(step.getTaskName());
            sb.append("\nCREATE OR REPLACE TASK ").append(task).append("\n");
            if (step.getDependsOnTasks().isEmpty()) {
                if (job.getSchedule() != null) {
                    sb.append("  SCHEDULE = 'USING CRON ").append(job.getSchedule()).append(" UTC'\n");
                }
            } else {
                sb.append("  AFTER ").append(step.getDependsOnTasks().stream()
                        .map(SqlDialect.SNOWFLAKE::quote)
                        .collect(Collectors.joining(", "))).append("\n");
            }
            sb.append("AS\n  ").append(terminate(step.getCommand())).append("\n");
        }
        return sb.toString();
    }

    private String airflow(ProjectedJob job, String targetKey) {
        Map<String, String> variables = new HashMap<>();
        List<Map<String, Object>> steps = new ArrayList<>();
        for (ProjectedJobStep step : job.getSteps()) {
            variables.put(step.getTaskName(), pythonIdentifier(step.getTaskName()));
        }
        for (ProjectedJobStep step : job.getSteps()) {
            Map<String, Object> model = new LinkedHashMap<>();
            model.put("variable", variables.get(step.getTaskName()));
            model.put("taskId", step.getTaskName());
            model.put("type", step.getType() == null ? "" : step.getType());
            model.put("command", pythonString(step.getCommand()));
            model.put("upstream", step.getDependsOnTasks().stream().map(variables::get).collect(Collectors.toList()));
            steps.add(model);
        }
        Map<String, Object> model = new HashMap<>();
        model.put("dagId", job.getPhysicalName());
        model.put("jobCode", job.getCode());
        model.put("schedule", job.getSchedule() == null ? "None" : pythonString(job.getSchedule()));
        model.put("target", targetKey);
        model.put("steps", steps);
        return templates.render("airflow_dag.py.ftl", model);
    }

    private static String layerSuffix(ProjectedJob job) {
        return job.getLayer() == null ? "" : " (" + job.getLayer() + ")";
    }

    private static String terminate(String command) {
        String trimmed = command == null ? "" : command.trim();
        return trimmed.endsWith(";") ? trimmed : trimmed + ";";
    }

    static String pythonString(String value) {
        String text = value == null ? "" : value;
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }

    static String pythonIdentifier(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9_]", "_");
        return Character.isDigit(cleaned.charAt(0)) ? "t_" + cleaned : cleaned;
    }
}
