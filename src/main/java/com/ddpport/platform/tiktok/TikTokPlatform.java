package com.ddpport.platform.tiktok;

import com.ddpport.core.ddp.ContainerType;
import com.ddpport.core.ddp.DdpCategory;
import com.ddpport.core.ddp.Language;
import com.ddpport.core.fs.ArchiveReader;
import com.ddpport.core.json.OrderedJsonReader;
import com.ddpport.core.table.ConsentTable;
import com.ddpport.core.table.RowSet;
import com.ddpport.core.table.Translatable;
import com.ddpport.core.table.VisualizationSpec;
import com.ddpport.core.tree.ShallowestMatchResolver;
import com.ddpport.core.tree.TreeFlattener;
import com.ddpport.logging.AppLogger;
import com.ddpport.platform.ExtractionResult;
import com.ddpport.platform.Platform;
import org.json.JSONArray;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TikTok data from the JSON export ({@code user_data.json}).
 * <p>
 * The nesting of the export changes between releases, so each activity list is located by its list key
 * wherever it sits, and each field of an entry is resolved with {@link ShallowestMatchResolver}.
 * Every table is donated through the capped donation mapping; the browsing history is split into chunks of
 * at most {@code chunkSize} rows of which only the first is shown.
 */
public final class TikTokPlatform implements Platform {
    private static final Logger LOGGER = AppLogger.get();

    static final String BROWSING_HISTORY = "tiktok_video_browsing_history";
    private static final String TIME = "Tijdstip";
    private static final String DATE_KEY = "(?i)date";

    private static final List<DdpCategory> CATEGORIES = List.of(
            DdpCategory.of("json_en", ContainerType.JSON, Language.EN,
                    "user_data.json",
                    "user_data_tiktok.json")
    );

    private static final List<TableDefinition> TABLES = List.of(
            new TableDefinition("tiktok_favorite_videos", "FavoriteVideoList",
                    Translatable.of("Favorite videos", "Favoriete video's"),
                    Translatable.of("In the table below you will find the videos that are among your favorites.",
                            "In de tabel hieronder vind je de video's die tot je favorieten behoren."),
                    List.of(column(TIME, DATE_KEY), column("Video", "(?i)link")), List.of()),
            new TableDefinition("tiktok_favorite_hashtags", "FavoriteHashtagList",
                    Translatable.of("Favorite hashtags", "Favoriete hashtags"),
                    Translatable.of("The table below lists the hashtags that are among your favorites.",
                            "In de tabel hieronder vind je de hashtags die tot je favorieten behoren."),
                    List.of(column(TIME, DATE_KEY), column("Hashtag", "(?i)link")), List.of()),
            new TableDefinition("tiktok_like_list", "ItemFavoriteList",
                    Translatable.of("Videos you have liked", "Video's die je hebt geliket"),
                    Translatable.of("The table below shows the videos you've liked and when that was.",
                            "In de tabel hieronder vind je de video's die je hebt geliket en wanneer dat was."),
                    List.of(column(TIME, DATE_KEY), column("Video", "(?i)link")), List.of()),
            new TableDefinition("tiktok_searches", "SearchList",
                    Translatable.of("Search terms", "Zoektermen"),
                    Translatable.of("The table below shows what you searched for and when that was.",
                            "De tabel hieronder laat zien wat je hebt gezocht en wanneer dat was."),
                    List.of(column(TIME, DATE_KEY), column("Zoekterm", "(?i)searchterm")),
                    List.of(VisualizationSpec.wordcloud(Translatable.same(""), "Zoekterm", false))),
            new TableDefinition("tiktok_share_history", "ShareHistoryList",
                    Translatable.of("Shared videos", "Gedeelde video's"),
                    Translatable.of("The table below shows what you shared, at what time and how.",
                            "In de tabel hieronder vind je wat je hebt gedeeld, op welk tijdstip en de manier waarop."),
                    List.of(column(TIME, DATE_KEY), column("Gedeelde inhoud", "(?i)sharedcontent"),
                            column("Link", "(?i)link"), column("Methode", "(?i)method")), List.of()),
            new TableDefinition("tiktok_followers", "FansList",
                    Translatable.same("Followers"),
                    Translatable.of("The table below shows your followers and when they started following you.",
                            "In de tabel hieronder vind je je followers en het tijdstip waarop ze je gingen followen."),
                    List.of(column(TIME, DATE_KEY), column("Gebruikersnaam", "(?i)username")), List.of()),
            new TableDefinition("tiktok_following", "Following",
                    Translatable.same("Following"),
                    Translatable.of("The table below shows users you follow and the time you started following them.",
                            "In de tabel hieronder vind je gebruikers die je volgt en het tijdstip waarop je ze bent gaan volgen."),
                    List.of(column(TIME, DATE_KEY), column("Gebruikersnaam", "(?i)username")), List.of()),
            new TableDefinition("tiktok_block_list", "BlockList",
                    Translatable.of("Blocked accounts on TikTok", "Geblokkeerde accounts op TikTok"),
                    Translatable.of("Below are users you block.", "Hieronder vind je gebruikers die je blokkeert."),
                    List.of(column(TIME, DATE_KEY), column("Gebruikersnaam", "(?i)username")), List.of())
    );

    private static final List<Column> BROWSING_COLUMNS = List.of(column(TIME, DATE_KEY), column("Video", "(?i)link"));

    private final int chunkSize;

    public TikTokPlatform(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.chunkSize = chunkSize;
    }

    @Override
    public String name() {
        return "TikTok";
    }

    @Override
    public List<DdpCategory> categories() {
        return CATEGORIES;
    }

    @Override
    public ExtractionResult extract(Path archive, DdpCategory category) {
        List<ConsentTable> tables = new ArrayList<>();
        Map<String, JSONArray> donations = new LinkedHashMap<>();

        Object root = switch (category.containerType()) {
            case JSON -> readUserData(archive, category);
            case HTML, CSV -> null;
        };
        if (root == null) {
            return new ExtractionResult(tables, donations);
        }

        RowSet browsing = toRows(root, "VideoList", BROWSING_COLUMNS);
        if (!browsing.isEmpty()) {
            List<RowSet> chunks = browsing.chunks(chunkSize);
            for (int i = 0; i < chunks.size(); i++) {
                String name = BROWSING_HISTORY + "_" + i;
                if (i == 0) {
                    tables.add(browsingTable(name, chunks.get(i)));
                }
                donations.put(name, chunks.get(i).toRecords());
            }
        }

        for (TableDefinition definition : TABLES) {
            RowSet rows = toRows(root, definition.listKey(), definition.columns());
            if (rows.isEmpty()) {
                continue;
            }
            tables.add(new ConsentTable(definition.name(), definition.title(), rows, definition.description(),
                    definition.visualizations()));
            donations.put(definition.name(), rows.toRecords());
        }
        return new ExtractionResult(tables, donations);
    }

    private ConsentTable browsingTable(String name, RowSet rows) {
        return new ConsentTable(name,
                Translatable.of("Watch history", "Kijkgeschiedenis"),
                rows,
                Translatable.of(
                        "The table below shows exactly which TikTok videos you watched and when that was. Do you have exactly "
                                + chunkSize + " rows in the table? Then we could not show all your data here, but all of it "
                                + "is included in your donation.",
                        "De tabel hieronder geeft aan welke TikTok video's je precies hebt bekeken en wanneer dat was. Heb je "
                                + "precies " + chunkSize + " rijen in de tabel? Dan konden we niet al je data laten zien, maar "
                                + "alles zit wel in je donatie."),
                List.of(VisualizationSpec.countByDate(VisualizationSpec.Type.AREA,
                        Translatable.of("Total number of videos watched per month", "Totaal aantal video's gekeken per maand"),
                        TIME, VisualizationSpec.DateFormat.MONTH, Translatable.same("Aantal"))));
    }

    private static Object readUserData(Path archive, DdpCategory category) {
        for (String fileName : category.knownFiles()) {
            try {
                Optional<byte[]> content = ArchiveReader.readMember(archive, fileName);
                if (content.isPresent()) {
                    return OrderedJsonReader.read(content.get());
                }
            } catch (IOException | RuntimeException ex) {
                LOGGER.log(Level.SEVERE, "Could not read " + fileName + ": " + ex.getMessage(), ex);
                return null;
            }
        }
        LOGGER.warning("No TikTok user data found in archive");
        return null;
    }

    /**
     * Builds a table from the first list stored under {@code listKey}, resolving one column per entry field.
     * A failure leaves the table empty.
     */
    static RowSet toRows(Object root, String listKey, List<Column> columns) {
        try {
            List<?> entries = findList(root, listKey);
            if (entries == null) {
                return RowSet.empty();
            }
            List<List<Object>> rows = new ArrayList<>();
            for (Object entry : entries) {
                Map<String, Object> flat = TreeFlattener.flatten(entry);
                List<Object> row = new ArrayList<>();
                for (Column column : columns) {
                    row.add(ShallowestMatchResolver.findFirst(flat, column.keyPattern()));
                }
                rows.add(row);
            }
            List<String> headers = new ArrayList<>();
            for (Column column : columns) {
                headers.add(column.header());
            }
            return new RowSet(headers, rows);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Could not extract " + listKey + ": " + ex.getMessage(), ex);
            return RowSet.empty();
        }
    }

    static List<?> findList(Object node, String listKey) {
        if (node instanceof Map<?, ?> map) {
            Object direct = map.get(listKey);
            if (direct instanceof List<?> list) {
                return list;
            }
            for (Object child : map.values()) {
                List<?> found = findList(child, listKey);
                if (found != null) {
                    return found;
                }
            }
        } else if (node instanceof List<?> list) {
            for (Object child : list) {
                List<?> found = findList(child, listKey);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static Column column(String header, String keyPattern) {
        return new Column(header, keyPattern);
    }

    record Column(String header, String keyPattern) {
    }

    private record TableDefinition(String name,
                                   String listKey,
                                   Translatable title,
                                   Translatable description,
                                   List<Column> columns,
                                   List<VisualizationSpec> visualizations) {
    }
}
