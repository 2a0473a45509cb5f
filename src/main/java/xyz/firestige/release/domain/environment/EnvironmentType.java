package xyz.firestige.release.domain.environment;

public enum EnvironmentType {
    DEVELOPMENT,
    STAGING,
    PRODUCTION
}
