package com.eventsourcing.infrastructure.config;

import com.eventsourcing.domain.model.DuplicateCreatedPolicy;
import com.eventsourcing.domain.model.UnknownEventPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private EventStore eventStore = new EventStore();
    private ProjectionCache projectionCache = new ProjectionCache();

    public EventStore getEventStore() {
        return eventStore;
    }

    public void setEventStore(EventStore eventStore) {
        this.eventStore = eventStore;
    }

    public ProjectionCache getProjectionCache() {
        return projectionCache;
    }

    public void setProjectionCache(ProjectionCache projectionCache) {
        this.projectionCache = projectionCache;
    }

    public static class EventStore {
        /** "jdbc" or "in-memory". */
        private String backend = "jdbc";
        private UnknownEventPolicy unknownEventPolicy = UnknownEventPolicy.PERMISSIVE;
        private DuplicateCreatedPolicy duplicateCreatedPolicy = DuplicateCreatedPolicy.LAST_WRITE_WINS;
        private int maxAppendAttempts = 3;
        private Duration backendTimeout = Duration.ofSeconds(5);

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public UnknownEventPolicy getUnknownEventPolicy() {
            return unknownEventPolicy;
        }

        public void setUnknownEventPolicy(UnknownEventPolicy unknownEventPolicy) {
            this.unknownEventPolicy = unknownEventPolicy;
        }

        public DuplicateCreatedPolicy getDuplicateCreatedPolicy() {
            return duplicateCreatedPolicy;
        }

        public void setDuplicateCreatedPolicy(DuplicateCreatedPolicy duplicateCreatedPolicy) {
            this.duplicateCreatedPolicy = duplicateCreatedPolicy;
        }

        public int getMaxAppendAttempts() {
            return maxAppendAttempts;
        }

        public void setMaxAppendAttempts(int maxAppendAttempts) {
            this.maxAppendAttempts = maxAppendAttempts;
        }

        public Duration getBackendTimeout() {
            return backendTimeout;
        }

        public void setBackendTimeout(Duration backendTimeout) {
            this.backendTimeout = backendTimeout;
        }
    }

    public static class ProjectionCache {
        /** "in-memory" or "redis". */
        private String type = "in-memory";
        private String keyPrefix = "student-view:";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }
}
