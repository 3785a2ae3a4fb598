package com.ddpport.platform;

import com.ddpport.core.ddp.DdpCategory;
import com.ddpport.core.ddp.DdpClassifier;
import com.ddpport.core.ddp.StatusCatalogue;
import com.ddpport.core.ddp.ValidationResult;

import java.nio.file.Path;
import java.util.List;

/**
 * A consumer platform whose data download packages can be validated and turned into consent tables.
 * Implementations hold no per-session state.
 */
public interface Platform {

    /**
     * Display name; also the donation key for whole-consent donations.
     */
    String name();

    /**
     * Known export shapes in priority order.
     */
    List<DdpCategory> categories();

    default StatusCatalogue statusCatalogue() {
        return StatusCatalogue.standard();
    }

    default ValidationResult validate(Path archive, DdpClassifier classifier) {
        return classifier.validate(archive, categories(), statusCatalogue());
    }

    /**
     * Extracts all tables from a validated archive. Failures of individual tables are logged and yield
     * no table; this method is not expected to throw.
     */
    ExtractionResult extract(Path archive, DdpCategory category);
}
