package com.ddpport.workflow;

import com.ddpport.config.ConfigService;
import com.ddpport.core.ddp.DdpCategory;
import com.ddpport.core.ddp.DdpClassifier;
import com.ddpport.core.ddp.ValidationResult;
import com.ddpport.core.table.ConsentTable;
import com.ddpport.core.table.RowSet;
import com.ddpport.core.table.Translatable;
import com.ddpport.logging.SessionLog;
import com.ddpport.platform.ExtractionResult;
import com.ddpport.platform.Platform;
import com.ddpport.platform.Platforms;
import org.json.JSONArray;
import org.json.JSONObject;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Drives one donation session: for each platform in order the participant picks a file, the file is
 * validated (with a retry loop), extracted, reviewed and donated or skipped.
 * <p>
 * The workflow never talks to the host directly. {@link #start()} and {@link #advance(HostResponse)} run
 * until the next page that needs an answer and return the commands produced on the way. Not thread-safe;
 * one instance serves one session.
 */
public final class DonationWorkflow {
    static final String NO_DATA_COLUMN = "No data found";
    static final Translatable NO_DATA_TITLE = Translatable.of(
            "Nothing went wrong, but we couldn't find any data in your files",
            "Er ging niks mis, maar we konden geen gegevens in jouw data vinden");

    private final SessionLog log;
    private final List<Platform> platforms;
    private final DdpClassifier classifier;
    private final WorkflowSettings settings;

    private WorkflowState state = WorkflowState.PROMPT_FILE;
    private int platformIndex;
    private boolean started;
    private boolean awaiting;
    private boolean finished;

    private Path archive;
    private ValidationResult validation;
    private ExtractionResult extraction;
    private ConsentForm consentForm;

    public DonationWorkflow(SessionLog log, List<Platform> platforms, DdpClassifier classifier,
                            WorkflowSettings settings) {
        this.log = Objects.requireNonNull(log, "log");
        this.platforms = List.copyOf(platforms);
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Workflow over the default platforms, configured from {@code config}.
     */
    public static DonationWorkflow create(String sessionId, ConfigService config) {
        return new DonationWorkflow(new SessionLog(sessionId),
                Platforms.defaults(config.getChunkSize()),
                new DdpClassifier(config.getMatchRule()),
                WorkflowSettings.from(config));
    }

    public String sessionId() {
        return log.sessionId();
    }

    public WorkflowState state() {
        return state;
    }

    public boolean isFinished() {
        return finished;
    }

    public Transition start() {
        if (started) {
            throw new IllegalStateException("Workflow already started");
        }
        started = true;
        List<Command> out = new ArrayList<>();
        List<WorkflowState> visited = new ArrayList<>();
        log.info(null, "Starting the donation flow");
        donateLogs(out, sessionId() + "-tracking");
        if (platforms.isEmpty()) {
            finish(out, visited);
        } else {
            enter(WorkflowState.PROMPT_FILE, visited);
        }
        return drive(null, out, visited);
    }

    /**
     * Answers the outstanding render command and runs to the next one.
     *
     * @throws IllegalStateException if no render command is awaiting an answer
     */
    public Transition advance(HostResponse response) {
        Objects.requireNonNull(response, "response");
        if (finished) {
            throw new IllegalStateException("Workflow has finished");
        }
        if (!awaiting) {
            throw new IllegalStateException("No page is awaiting a response in state " + state);
        }
        awaiting = false;
        return drive(response, new ArrayList<>(), new ArrayList<>());
    }

    private Transition drive(HostResponse response, List<Command> out, List<WorkflowState> visited) {
        HostResponse pending = response;
        while (!finished) {
            switch (state) {
                case PROMPT_FILE -> {
                    if (pending == null) {
                        promptFile(out);
                        return suspend(out, visited);
                    }
                    onFileChosen(pending, out, visited);
                    pending = null;
                }
                case VALIDATING -> validate(out, visited);
                case RETRY_CONFIRM -> {
                    if (pending == null) {
                        out.add(new RenderCommand(platform().name(), header(), ConfirmPrompt.retry(platform().name())));
                        return suspend(out, visited);
                    }
                    onRetryAnswered(pending, out, visited);
                    pending = null;
                }
                case EXTRACTING -> extract(visited);
                case REVIEW_CONSENT -> {
                    if (pending == null) {
                        reviewConsent(out);
                        return suspend(out, visited);
                    }
                    onConsentAnswered(pending, out, visited);
                    pending = null;
                }
                case DONATED, SKIPPED, SKIPPED_AFTER_REVIEW -> nextPlatform(out, visited);
                case FINISHED -> throw new IllegalStateException("Finished workflow still running");
            }
        }
        return new Transition(state, null, out, visited, false);
    }

    private void promptFile(List<Command> out) {
        String name = platform().name();
        log.info(name, "Prompt for file for " + name);
        donateLogs(out, platformLogKey());
        out.add(new RenderCommand(name, header(), FilePrompt.forPlatform(name, settings.fileExtensions())));
    }

    private void onFileChosen(HostResponse response, List<Command> out, List<WorkflowState> visited) {
        String name = platform().name();
        Optional<Path> chosen = response.kind() == HostResponse.Kind.STRING ? toPath(response.value()) : Optional.empty();
        if (chosen.isEmpty()) {
            log.info(name, "Skipped at file selection ending flow");
            status(out, "SKIPPED");
            donateLogs(out, platformLogKey());
            enter(WorkflowState.SKIPPED, visited);
            return;
        }
        archive = chosen.get();
        log.info(name, "File submitted: " + archive.getFileName());
        status(out, "FILE_SUBMITTED");
        enter(WorkflowState.VALIDATING, visited);
    }

    private void validate(List<Command> out, List<WorkflowState> visited) {
        String name = platform().name();
        validation = platform().validate(archive, classifier);
        if (validation.isRecognized()) {
            log.info(name, "Payload for " + name + " is valid as " + validation.category().id());
            status(out, "VALID_DDP");
            donateLogs(out, platformLogKey());
            enter(WorkflowState.EXTRACTING, visited);
        } else {
            log.info(name, "Not a valid %s file (%s); prompt for retry".formatted(name, validation.status().description()));
            status(out, "INVALID_DDP");
            donateLogs(out, platformLogKey());
            enter(WorkflowState.RETRY_CONFIRM, visited);
        }
    }

    private void onRetryAnswered(HostResponse response, List<Command> out, List<WorkflowState> visited) {
        if (response.kind() == HostResponse.Kind.TRUE) {
            log.info(platform().name(), "Retrying file selection");
            status(out, "RETRY");
            enter(WorkflowState.PROMPT_FILE, visited);
            return;
        }
        log.info(platform().name(), "Skipped during retry ending flow");
        status(out, "SKIPPED_DURING_RETRY");
        donateLogs(out, platformLogKey());
        enter(WorkflowState.SKIPPED, visited);
    }

    private void extract(List<WorkflowState> visited) {
        String name = platform().name();
        DdpCategory category = validation.category();
        try {
            extraction = platform().extract(archive, category);
        } catch (RuntimeException ex) {
            log.warning(name, "Extraction failed, treating as no data: " + ex.getMessage(), ex);
            extraction = ExtractionResult.empty();
        }
        log.info(name, "Extracted %d table(s) from %s".formatted(extraction.tables().size(), archive.getFileName()));
        enter(WorkflowState.REVIEW_CONSENT, visited);
    }

    private void reviewConsent(List<Command> out) {
        String name = platform().name();
        List<ConsentTable> tables = extraction.tables();
        if (tables.isEmpty()) {
            log.info(name, "No data found for " + name);
            status(out, "NO_DATA_FOUND");
            tables = List.of(noDataTable(name));
        } else {
            status(out, "PROMPT_CONSENT");
        }
        consentForm = new ConsentForm(tables);
        log.info(name, "Prompt consent for " + name);
        donateLogs(out, platformLogKey());
        out.add(new RenderCommand(name, header(), consentForm));
    }

    private void onConsentAnswered(HostResponse response, List<Command> out, List<WorkflowState> visited) {
        String name = platform().name();
        if (response.kind() != HostResponse.Kind.JSON) {
            log.info(name, "Skipped after reviewing consent: " + name);
            status(out, "SKIP_REVIEW_CONSENT");
            donateLogs(out, platformLogKey());
            enter(WorkflowState.SKIPPED_AFTER_REVIEW, visited);
            return;
        }
        Optional<Map<String, JSONArray>> mapping = extraction.donationMapping();
        if (mapping.isPresent()) {
            for (Map.Entry<String, JSONArray> entry : mapping.get().entrySet()) {
                String payload = new JSONObject().put(entry.getKey(), entry.getValue()).toString();
                out.add(new DonateCommand(name + "_" + entry.getKey(), payload));
            }
            log.info(name, "Donated %d capped table(s)".formatted(mapping.get().size()));
        } else {
            String payload = response.value().isBlank() ? consentForm.toDonationPayload() : response.value();
            out.add(new DonateCommand(name, payload));
            log.info(name, "Donated consent for " + name);
        }
        status(out, "DONATED");
        donateLogs(out, platformLogKey());
        enter(WorkflowState.DONATED, visited);
    }

    private void nextPlatform(List<Command> out, List<WorkflowState> visited) {
        platformIndex++;
        archive = null;
        validation = null;
        extraction = null;
        consentForm = null;
        if (platformIndex < platforms.size()) {
            enter(WorkflowState.PROMPT_FILE, visited);
        } else {
            finish(out, visited);
        }
    }

    private void finish(List<Command> out, List<WorkflowState> visited) {
        log.info(null, "Donation flow finished");
        donateLogs(out, sessionId() + "-tracking");
        enter(WorkflowState.FINISHED, visited);
        finished = true;
        out.add(new ExitCommand(0, "Success"));
        out.add(new RenderCommand(null, Translatable.of("Thank you", "Bedankt"), new EndPage()));
    }

    private Transition suspend(List<Command> out, List<WorkflowState> visited) {
        awaiting = true;
        return new Transition(state, platform().name(), out, visited, true);
    }

    private void enter(WorkflowState next, List<WorkflowState> visited) {
        state = next;
        visited.add(next);
    }

    private void status(List<Command> out, String status) {
        String key = "%s-%s-%s".formatted(sessionId(), platform().name(), status.replace('_', '-'));
        out.add(new StatusCommand(key, status));
    }

    private void donateLogs(List<Command> out, String key) {
        if (!settings.donateLogs()) {
            return;
        }
        JSONArray lines = new JSONArray(log.snapshot());
        out.add(new DonateCommand(key, new JSONObject().put("logs", lines).toString()));
    }

    private String platformLogKey() {
        return "%s-%s-tracking".formatted(sessionId(), platform().name());
    }

    private Platform platform() {
        return platforms.get(platformIndex);
    }

    private static Translatable header() {
        return Translatable.of("Data donation", "Datadonatie");
    }

    private Optional<Path> toPath(String value) {
        if (value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(value));
        } catch (InvalidPathException ex) {
            log.warning(platform().name(), "Unusable file reference: " + value, ex);
            return Optional.empty();
        }
    }

    static ConsentTable noDataTable(String platform) {
        return new ConsentTable(platform.toLowerCase(Locale.ROOT) + "_no_data_found",
                NO_DATA_TITLE,
                RowSet.notice(NO_DATA_COLUMN, NO_DATA_COLUMN),
                null);
    }
}
