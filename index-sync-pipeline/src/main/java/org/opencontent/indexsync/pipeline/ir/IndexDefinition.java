package org.opencontent.indexsync.pipeline.ir;

import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;

/**
 * Definition of a search index. An index with no included content types never receives documents.
 */
@Builder(toBuilder = true)
public record IndexDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("includedTypes") @Singular Set<String> includedTypes,
    @JsonProperty("indexLatestVersion") boolean indexLatestVersion
) {
    public IndexDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Index name must not be blank");
        }
        includedTypes = includedTypes == null ? Set.of() : Set.copyOf(includedTypes);
    }

    /** True when at least one content type is routed to this index. */
    @JsonIgnore
    public boolean isActive() {
        return !includedTypes.isEmpty();
    }

    public boolean includes(String contentType) {
        return contentType != null && includedTypes.contains(contentType);
    }

    public static IndexDefinition of(String name, Set<String> includedTypes, boolean indexLatestVersion) {
        return new IndexDefinition(Objects.requireNonNull(name, "name"), includedTypes, indexLatestVersion);
    }
}
