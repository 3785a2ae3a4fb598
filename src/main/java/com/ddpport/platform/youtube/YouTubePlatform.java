package com.ddpport.platform.youtube;

import com.ddpport.core.ddp.ContainerType;
import com.ddpport.core.ddp.DdpCategory;
import com.ddpport.core.ddp.Language;
import com.ddpport.core.fs.ArchiveReader;
import com.ddpport.core.table.ConsentTable;
import com.ddpport.core.table.CsvTableReader;
import com.ddpport.core.table.RowSet;
import com.ddpport.core.table.TimestampNormalizer;
import com.ddpport.core.table.Translatable;
import com.ddpport.core.table.VisualizationSpec;
import com.ddpport.logging.AppLogger;
import com.ddpport.platform.ExtractionResult;
import com.ddpport.platform.Platform;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * YouTube data from a Google Takeout export: watch history, search history and subscriptions.
 */
public final class YouTubePlatform implements Platform {
    private static final Logger LOGGER = AppLogger.get();

    static final String DATE_STANDARD = "Date standard format";
    private static final String NOT_IMPLEMENTED_COLUMN = "Extraction not implemented";
    private static final String NOT_IMPLEMENTED_TEXT =
            "Er zit wel data in jouw data package, maar we hebben het er niet uitgehaald";

    private static final List<DdpCategory> CATEGORIES = List.of(
            DdpCategory.of("html_en", ContainerType.HTML, Language.EN,
                    "archive_browser.html",
                    "watch-history.html",
                    "my-comments.html",
                    "my-live-chat-messages.html",
                    "subscriptions.csv",
                    "comments.csv"),
            DdpCategory.of("html_nl", ContainerType.HTML, Language.NL,
                    "archive_browser.html",
                    "kijkgeschiedenis.html",
                    "zoekgeschiedenis.html",
                    "mijn-reacties.html",
                    "abonnementen.csv",
                    "reacties.csv")
    );

    @Override
    public String name() {
        return "YouTube";
    }

    @Override
    public List<DdpCategory> categories() {
        return CATEGORIES;
    }

    @Override
    public ExtractionResult extract(Path archive, DdpCategory category) {
        List<ConsentTable> tables = new ArrayList<>();
        FileNames files = FileNames.forLanguage(category.language());

        RowSet watchHistory = watchHistory(archive, category, files).fillNulls("Channel", "");
        if (!watchHistory.isEmpty()) {
            tables.add(new ConsentTable("youtube_watch_history",
                    Translatable.of("Your YouTube watch history", "Je YouTube kijkgeschiedenis"),
                    watchHistory,
                    Translatable.of(
                            "In this table you find the videos you watched on YouTube sorted over time. Below, you find "
                                    + "a timeline of the number of videos you watched per month, a wordcloud of the channels "
                                    + "you viewed and a histogram of the videos you watched per hour of the day.",
                            "In deze tabel vind je de video's die je hebt bekeken op YouTube, gesorteerd op tijd. Hieronder "
                                    + "vind je een tijdlijn met het aantal bekeken video's per maand, een wordcloud van de "
                                    + "kanalen die je hebt bekeken en een histogram van de video's per uur van de dag."),
                    List.of(
                            VisualizationSpec.countByDate(VisualizationSpec.Type.AREA,
                                    Translatable.of("The total number of YouTube videos you have watched per month",
                                            "Het totale aantal YouTube-video's dat je per maand hebt bekeken"),
                                    DATE_STANDARD, VisualizationSpec.DateFormat.MONTH,
                                    Translatable.of("number of views", "aantal keer gekeken")),
                            VisualizationSpec.wordcloud(
                                    Translatable.of("The most frequently watched YouTube channels",
                                            "De meest bekeken YouTube-kanalen"),
                                    "Channel", false),
                            VisualizationSpec.countByDate(VisualizationSpec.Type.BAR,
                                    Translatable.of("The total number of YouTube videos you have watched per hour of the day",
                                            "Het totale aantal YouTube-video's dat je hebt bekeken per uur van de dag"),
                                    DATE_STANDARD, VisualizationSpec.DateFormat.HOUR_CYCLE, null))));
        }

        RowSet searchHistory = searchHistory(archive, category, files);
        if (!searchHistory.isEmpty()) {
            tables.add(new ConsentTable("youtube_search_history",
                    Translatable.of("Your YouTube search history", "Je YouTube-zoekgeschiedenis"),
                    searchHistory,
                    Translatable.of(
                            "In this table you find the search terms you have used on YouTube sorted over time.",
                            "In deze tabel vind je de zoektermen die je hebt gebruikt op YouTube, gesorteerd op tijd."),
                    List.of(VisualizationSpec.wordcloud(
                            Translatable.of("Words you most searched for", "Woorden waarop je het meest hebt gezocht"),
                            "Search Terms", true))));
        }

        RowSet subscriptions = subscriptions(archive, files);
        if (!subscriptions.isEmpty()) {
            tables.add(new ConsentTable("youtube_subscriptions",
                    Translatable.of("Your YouTube channel subscriptions", "Je YouTube-kanaal abonnementen"),
                    subscriptions,
                    Translatable.of("In this table, you find the YouTube channels you are subscribed to.",
                            "In deze tabel vind je de YouTube-kanalen waarop je geabonneerd bent.")));
        }

        return ExtractionResult.of(tables);
    }

    RowSet watchHistory(Path archive, DdpCategory category, FileNames files) {
        return switch (category.containerType()) {
            case HTML -> scrape(archive, files.watchHistory(), false);
            case JSON, CSV -> RowSet.notice(NOT_IMPLEMENTED_COLUMN, NOT_IMPLEMENTED_TEXT);
        };
    }

    RowSet searchHistory(Path archive, DdpCategory category, FileNames files) {
        return switch (category.containerType()) {
            case HTML -> scrape(archive, files.searchHistory(), true);
            case JSON, CSV -> RowSet.notice(NOT_IMPLEMENTED_COLUMN, NOT_IMPLEMENTED_TEXT);
        };
    }

    RowSet subscriptions(Path archive, FileNames files) {
        try {
            Optional<byte[]> content = ArchiveReader.readMember(archive, files.subscriptions());
            if (content.isEmpty()) {
                LOGGER.fine(files.subscriptions() + " not present in archive");
                return RowSet.empty();
            }
            return new CsvTableReader().read(content.get());
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Could not read " + files.subscriptions() + ": " + ex.getMessage(), ex);
            return RowSet.empty();
        }
    }

    private RowSet scrape(Path archive, String fileName, boolean searches) {
        try {
            Optional<byte[]> content = ArchiveReader.readMember(archive, fileName);
            if (content.isEmpty()) {
                LOGGER.fine(fileName + " not present in archive");
                return RowSet.empty();
            }
            List<TakeoutHtmlParser.Activity> activities =
                    TakeoutHtmlParser.parse(new String(content.get(), StandardCharsets.UTF_8));

            List<List<Object>> rows = new ArrayList<>();
            for (TakeoutHtmlParser.Activity activity : activities) {
                if (searches) {
                    if (activity.advertisement()) {
                        continue;
                    }
                    rows.add(Arrays.asList(activity.title(), activity.url(), activity.date()));
                } else {
                    rows.add(Arrays.asList(activity.title(), activity.url(),
                            activity.advertisement() ? "Yes" : "No", activity.channel(), activity.date()));
                }
            }
            List<String> columns = searches
                    ? List.of("Search Terms", "Url", "Date")
                    : List.of("Title", "Url", "Advertisement", "Channel", "Date");
            return new RowSet(columns, rows)
                    .withDerivedColumn(DATE_STANDARD, "Date", date -> TimestampNormalizer.toIso8601((String) date));
        } catch (IOException | RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Could not extract " + fileName + ": " + ex.getMessage(), ex);
            return RowSet.empty();
        }
    }

    /**
     * Member names of the tables, which are translated along with the export language.
     */
    record FileNames(String watchHistory, String searchHistory, String subscriptions) {

        static FileNames forLanguage(Language language) {
            return switch (language) {
                case EN -> new FileNames("watch-history.html", "search-history.html", "subscriptions.csv");
                case NL -> new FileNames("kijkgeschiedenis.html", "zoekgeschiedenis.html", "abonnementen.csv");
            };
        }
    }
}
