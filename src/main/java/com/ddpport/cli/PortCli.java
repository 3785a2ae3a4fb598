package com.ddpport.cli;

import com.ddpport.config.ConfigService;
import com.ddpport.core.table.RowSet;
import com.ddpport.core.tree.JsonMemberDump;
import com.ddpport.logging.AppLogger;
import com.ddpport.workflow.Command;
import com.ddpport.workflow.ConfirmPrompt;
import com.ddpport.workflow.ConsentForm;
import com.ddpport.workflow.DonateCommand;
import com.ddpport.workflow.DonationWorkflow;
import com.ddpport.workflow.ExitCommand;
import com.ddpport.workflow.FilePrompt;
import com.ddpport.workflow.HostResponse;
import com.ddpport.workflow.RenderCommand;
import com.ddpport.workflow.StatusCommand;
import com.ddpport.workflow.Transition;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Headless host that runs a donation session against local archives.
 * <pre>
 *   PortCli --session &lt;id&gt; --out &lt;dir&gt; [--decline] [Platform=archive.zip ...]
 *   PortCli --dump-json &lt;archive.zip&gt;
 * </pre>
 * File prompts are answered with the archive given for the platform (or skipped), retry questions with
 * "continue" and consent forms with accept, or decline when {@code --decline} is given.
 * Donations are written to {@code <out>/<key>.json}, status events are appended to {@code <out>/status.log}.
 */
public final class PortCli {
    private static final Logger LOGGER = AppLogger.get();

    static final int USAGE_ERROR = 64;
    static final String USAGE =
            "Usage: PortCli --session <id> --out <dir> [--decline] [Platform=archive.zip ...]\n"
                    + "       PortCli --dump-json <archive.zip>";

    private PortCli() {
    }

    public static void main(String[] args) {
        System.exit(run(args, ConfigService.getInstance(), System.out));
    }

    static int run(String[] args, ConfigService config, PrintStream console) {
        Options options;
        try {
            options = Options.parse(args);
        } catch (IllegalArgumentException ex) {
            console.println(ex.getMessage());
            console.println(USAGE);
            return USAGE_ERROR;
        }
        if (options.dumpArchive() != null) {
            return dump(options.dumpArchive(), console);
        }
        try {
            return runSession(options, DonationWorkflow.create(options.sessionId(), config), console);
        } catch (IOException ex) {
            LOGGER.severe("Could not write session output to %s: %s".formatted(options.outDir(), ex.getMessage()));
            console.println("Failed: " + ex.getMessage());
            return 1;
        }
    }

    static int runSession(Options options, DonationWorkflow workflow, PrintStream console) throws IOException {
        Files.createDirectories(options.outDir());
        int exitCode = 0;
        Transition transition = workflow.start();
        while (true) {
            for (Command command : transition.commands()) {
                exitCode = handle(command, options, console, exitCode);
            }
            if (!transition.awaitingResponse()) {
                return exitCode;
            }
            RenderCommand page = (RenderCommand) transition.commands().get(transition.commands().size() - 1);
            transition = workflow.advance(answer(page, options));
        }
    }

    private static int handle(Command command, Options options, PrintStream console, int exitCode) throws IOException {
        if (command instanceof DonateCommand donate) {
            Path target = options.outDir().resolve(fileNameFor(donate.key()) + ".json");
            Files.writeString(target, donate.payload(), StandardCharsets.UTF_8);
            console.println("Donated " + donate.key());
        } else if (command instanceof StatusCommand status) {
            Files.writeString(options.outDir().resolve("status.log"),
                    status.key() + " " + status.status() + System.lineSeparator(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } else if (command instanceof ExitCommand exit) {
            console.println("Finished: %d %s".formatted(exit.code(), exit.message()));
            return exit.code();
        } else if (command instanceof RenderCommand render) {
            console.println("[%s] %s".formatted(render.platform() == null ? "-" : render.platform(),
                    render.body().getClass().getSimpleName()));
        }
        return exitCode;
    }

    static HostResponse answer(RenderCommand page, Options options) {
        if (page.body() instanceof FilePrompt) {
            Path archive = options.archives().get(page.platform());
            return archive == null ? HostResponse.none() : HostResponse.string(archive.toString());
        }
        if (page.body() instanceof ConfirmPrompt) {
            return HostResponse.ofFalse();
        }
        if (page.body() instanceof ConsentForm form) {
            return options.decline() ? HostResponse.none() : HostResponse.json(form.toDonationPayload());
        }
        throw new IllegalStateException("Unexpected page " + page.body().getClass().getSimpleName());
    }

    private static int dump(Path archive, PrintStream console) {
        RowSet rows = JsonMemberDump.dumpJsonMembers(archive);
        console.println(String.join(" | ", rows.columns()));
        for (List<Object> row : rows.rows()) {
            console.println("%s | %s | %s".formatted(row.get(0), row.get(1), row.get(2) == null ? "" : row.get(2)));
        }
        return 0;
    }

    static String fileNameFor(String key) {
        return key.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    record Options(String sessionId, Path outDir, boolean decline, Map<String, Path> archives, Path dumpArchive) {

        static Options parse(String[] args) {
            String session = null;
            Path out = null;
            boolean decline = false;
            Path dump = null;
            Map<String, Path> archives = new LinkedHashMap<>();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--session" -> session = value(args, ++i, arg);
                    case "--out" -> out = Path.of(value(args, ++i, arg));
                    case "--decline" -> decline = true;
                    case "--dump-json" -> dump = Path.of(value(args, ++i, arg));
                    default -> {
                        int eq = arg.indexOf('=');
                        if (arg.startsWith("--") || eq <= 0 || eq == arg.length() - 1) {
                            throw new IllegalArgumentException("Unknown argument: " + arg);
                        }
                        archives.put(arg.substring(0, eq), Path.of(arg.substring(eq + 1)));
                    }
                }
            }
            if (dump != null) {
                return new Options(session, out, decline, archives, dump);
            }
            if (session == null || session.isBlank()) {
                throw new IllegalArgumentException("Missing --session");
            }
            if (out == null) {
                throw new IllegalArgumentException("Missing --out");
            }
            return new Options(session, out, decline, Map.copyOf(archives), null);
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return args[index];
        }
    }
}
