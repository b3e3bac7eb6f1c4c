package io.taskloom.backlog;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the external backlog. Read every cycle and never written by taskloom.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacklogItem(
        @JsonProperty("number") int number,
        @JsonProperty("title") String title,
        @JsonProperty("status") BacklogStatus status,
        @JsonProperty("has_spec") @JsonAlias("hasSpec") boolean hasSpec
) {
    public BacklogItem {
        title = title == null ? "" : title;
        status = status == null ? BacklogStatus.PLANNED : status;
    }

    public boolean needsSpec() {
        return !hasSpec && status != BacklogStatus.COMPLETE;
    }

    public boolean implementable() {
        return hasSpec && status == BacklogStatus.PLANNED;
    }
}
