package com.resumetailor.domain.optimization.model;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Curated technology/role vocabulary and the "is technical" predicate derived from it.
 */
public final class TechnicalVocabulary {

    // Languages, frameworks, platforms, practices and role terms seen in job postings
    private static final Set<String> CURATED_TERMS = Set.of(
            "java", "python", "javascript", "typescript", "kotlin", "scala", "golang", "go", "rust",
            "c++", "c#", "ruby", "php", "swift", "sql", "nosql", "bash", "r",
            "spring", "spring boot", "hibernate", "django", "flask", "fastapi", "react", "angular",
            "vue", "node.js", "nodejs", "express", "next.js", ".net", "graphql", "rest", "grpc",
            "docker", "kubernetes", "helm", "terraform", "ansible", "jenkins", "cicd", "ci", "cd",
            "github actions", "gitlab", "git", "linux", "unix",
            "aws", "azure", "gcp", "cloud", "serverless", "lambda", "microservices",
            "kafka", "rabbitmq", "redis", "elasticsearch", "postgresql", "mysql", "mongodb",
            "oracle", "cassandra", "dynamodb", "snowflake", "spark", "hadoop", "airflow", "etl",
            "tensorflow", "pytorch", "keras", "scikit-learn", "pandas", "numpy",
            "machine learning", "deep learning", "neural networks", "nlp", "computer vision",
            "data pipelines", "data engineering", "data science", "analytics", "statistics",
            "model deployment", "mlops", "devops", "sre", "observability", "prometheus", "grafana",
            "agile", "scrum", "kanban", "jira", "tdd", "unit testing", "junit", "selenium",
            "security", "oauth", "containerization", "orchestration", "api", "apis",
            "architecture", "distributed systems", "scalability", "performance",
            "backend", "frontend", "full stack", "fullstack", "mobile", "android", "ios",
            "engineer", "developer", "architect", "analyst", "scientist", "administrator"
    );

    private static final Pattern VERSION_OR_DIGIT = Pattern.compile(".*\\d.*");

    private static final Pattern ACRONYM = Pattern.compile("[A-Z]{2,5}");

    private TechnicalVocabulary() {
    }

    /**
     * True when the term is a curated technology/role term, carries a digit or version,
     * or is a 2-5 letter uppercase acronym (checked on the display form).
     */
    public static boolean isTechnical(String term) {
        if (term == null || term.isBlank()) {
            return false;
        }
        String trimmed = term.strip();
        if (CURATED_TERMS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return true;
        }
        if (VERSION_OR_DIGIT.matcher(trimmed).matches()) {
            return true;
        }
        return ACRONYM.matcher(trimmed).matches();
    }
}
