package com.ddpport.core.ddp;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One concrete shape a platform's export can take: file layout, language and container type.
 */
public record DdpCategory(String id, ContainerType containerType, Language language, Set<String> knownFiles) {

    public DdpCategory {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(containerType, "containerType");
        Objects.requireNonNull(language, "language");
        knownFiles = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(knownFiles, "knownFiles")));
    }

    public static DdpCategory of(String id, ContainerType containerType, Language language, String... knownFiles) {
        return new DdpCategory(id, containerType, language, new LinkedHashSet<>(List.of(knownFiles)));
    }

    int overlapWith(Collection<String> fileNames) {
        int overlap = 0;
        for (String known : knownFiles) {
            if (fileNames.contains(known)) {
                overlap++;
            }
        }
        return overlap;
    }
}
