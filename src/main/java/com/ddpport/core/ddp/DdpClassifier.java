package com.ddpport.core.ddp;

import com.ddpport.core.fs.ArchiveReader;
import com.ddpport.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Fingerprints a data download package by the names of the files it contains.
 * <p>
 * Categories are tried in declared order and the first one whose known files overlap the archive
 * (according to the {@link MatchRule}) wins, regardless of how large the overlap of later categories is.
 * Instances are immutable and safe to share between sessions.
 */
public final class DdpClassifier {
    private static final Logger LOGGER = AppLogger.get();

    private static final Set<String> DATA_SUFFIXES = Set.of(".json", ".csv", ".html", ".txt");

    private final MatchRule matchRule;

    public DdpClassifier() {
        this(MatchRule.ANY_OVERLAP);
    }

    public DdpClassifier(MatchRule matchRule) {
        this.matchRule = Objects.requireNonNull(matchRule, "matchRule");
    }

    public MatchRule matchRule() {
        return matchRule;
    }

    public Optional<DdpCategory> classify(Collection<String> fileNames, List<DdpCategory> categories) {
        Set<String> present = new LinkedHashSet<>(fileNames);
        for (DdpCategory category : categories) {
            int overlap = category.overlapWith(present);
            if (matchRule.accepts(overlap, category.knownFiles().size())) {
                LOGGER.fine("Matched category %s (%d known files present)".formatted(category.id(), overlap));
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Opens the archive, classifies it and selects the matching status from {@code catalogue}.
     * Never throws for bad input: unreadable archives map to {@link StatusCatalogue#BAD_ARCHIVE}.
     */
    public ValidationResult validate(Path archive, List<DdpCategory> categories, StatusCatalogue catalogue) {
        List<String> members;
        try {
            members = ArchiveReader.listMemberNames(archive);
        } catch (IOException | RuntimeException ex) {
            LOGGER.info("Could not open %s as zip archive: %s".formatted(archive.getFileName(), ex.getMessage()));
            return ValidationResult.rejected(catalogue.get(StatusCatalogue.BAD_ARCHIVE));
        }

        List<String> dataFiles = new ArrayList<>();
        for (String name : members) {
            if (hasDataSuffix(name)) {
                LOGGER.fine("Found: " + name + " in zip");
                dataFiles.add(name);
            }
        }

        Optional<DdpCategory> category = classify(dataFiles, categories);
        if (category.isPresent()) {
            return ValidationResult.recognized(catalogue.get(StatusCatalogue.VALID), category.get());
        }
        return ValidationResult.rejected(catalogue.get(StatusCatalogue.UNHANDLED_FORMAT));
    }

    private static boolean hasDataSuffix(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 && DATA_SUFFIXES.contains(name.substring(dot).toLowerCase(Locale.ROOT));
    }
}
