package com.ddpport.platform.tiktok;

import com.ddpport.core.ddp.DdpCategory;
import com.ddpport.core.ddp.DdpClassifier;
import com.ddpport.core.json.OrderedJsonReader;
import com.ddpport.core.table.ConsentTable;
import com.ddpport.core.table.RowSet;
import com.ddpport.platform.ExtractionResult;
import com.ddpport.testing.ZipFixtures;
import org.json.JSONArray;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TikTokPlatformTest {

    private static final String USER_DATA = """
            {
              "Activity": {
                "Video Browsing History": {
                  "VideoList": [
                    {"Date": "2023-01-01 10:00:00", "Link": "https://www.tiktokv.com/share/video/1/"},
                    {"Date": "2023-01-02 11:00:00", "Link": "https://www.tiktokv.com/share/video/2/"},
                    {"Date": "2023-01-03 12:00:00", "Link": "https://www.tiktokv.com/share/video/3/"}
                  ]
                },
                "Favorite Videos": {
                  "FavoriteVideoList": [
                    {"Date": "2023-02-01 09:00:00", "Link": "https://www.tiktokv.com/share/video/9/"}
                  ]
                },
                "Search History": {
                  "SearchList": [
                    {"Date": "2023-03-01 08:00:00", "SearchTerm": "cats"}
                  ]
                },
                "Share History": {
                  "ShareHistoryList": [
                    {"Date": "2023-04-01 07:00:00", "SharedContent": "video", "Link": "https://www.tiktokv.com/share/video/4/", "Method": "chat_head"}
                  ]
                },
                "Following List": {
                  "Following": [
                    {"Date": "2023-05-01 06:00:00", "UserName": "friend"}
                  ]
                }
              },
              "Comment": {"Comments": {"CommentsList": []}}
            }
            """;

    @TempDir
    Path tempDir;

    private final TikTokPlatform platform = new TikTokPlatform(2);

    private ExtractionResult extract(Path archive) {
        DdpCategory category = platform.validate(archive, new DdpClassifier()).category();
        return platform.extract(archive, category);
    }

    @Test
    void recognizesUserDataExport() throws IOException {
        Path archive = ZipFixtures.zip(tempDir.resolve("tiktok.zip"), "TikTok/user_data.json", USER_DATA);

        assertEquals("json_en", platform.validate(archive, new DdpClassifier()).category().id());
    }

    @Test
    void showsFirstBrowsingChunkAndDonatesAll() throws IOException {
        Path archive = ZipFixtures.zip(tempDir.resolve("tiktok.zip"), "user_data.json", USER_DATA);

        ExtractionResult result = extract(archive);

        assertEquals(List.of("tiktok_video_browsing_history_0", "tiktok_favorite_videos", "tiktok_searches",
                        "tiktok_share_history", "tiktok_following"),
                result.tables().stream().map(ConsentTable::name).toList());
        RowSet shown = result.tables().get(0).rows();
        assertEquals(List.of("Tijdstip", "Video"), shown.columns());
        assertEquals(2, shown.size());

        Map<String, JSONArray> donations = result.donationMapping().orElseThrow();
        assertEquals(List.of("tiktok_video_browsing_history_0", "tiktok_video_browsing_history_1",
                        "tiktok_favorite_videos", "tiktok_searches", "tiktok_share_history", "tiktok_following"),
                new ArrayList<>(donations.keySet()));
        assertEquals(1, donations.get("tiktok_video_browsing_history_1").length());
        assertEquals("https://www.tiktokv.com/share/video/3/",
                donations.get("tiktok_video_browsing_history_1").getJSONObject(0).getString("Video"));
    }

    @Test
    void resolvesColumnsByKeyPattern() throws IOException {
        Path archive = ZipFixtures.zip(tempDir.resolve("tiktok.zip"), "user_data.json", USER_DATA);

        List<ConsentTable> tables = extract(archive).tables();

        RowSet searches = tables.get(2).rows();
        assertEquals("cats", searches.get(0, "Zoekterm"));
        assertEquals("2023-03-01 08:00:00", searches.get(0, "Tijdstip"));
        RowSet shares = tables.get(3).rows();
        assertEquals("video", shares.get(0, "Gedeelde inhoud"));
        assertEquals("chat_head", shares.get(0, "Methode"));
        assertEquals("friend", tables.get(4).rows().get(0, "Gebruikersnaam"));
    }

    @Test
    void shallowerFieldWinsWithinAnEntry() {
        Object root = OrderedJsonReader.read(
                "{\"VideoList\": [{\"Meta\": {\"Link\": \"deep\"}, \"Link\": \"shallow\", \"Date\": \"d\"}]}");

        RowSet rows = TikTokPlatform.toRows(root, "VideoList",
                List.of(new TikTokPlatform.Column("Video", "(?i)link")));

        assertEquals("shallow", rows.get(0, "Video"));
    }

    @Test
    void missingOrBrokenUserDataYieldsNoTables() throws IOException {
        Path missing = ZipFixtures.zip(tempDir.resolve("other.zip"), "user_data_tiktok.json", "{\"Activity\": {}}");
        Path broken = ZipFixtures.zip(tempDir.resolve("broken.zip"), "user_data.json", "{\"Activity\": ");

        ExtractionResult empty = extract(missing);
        ExtractionResult failed = extract(broken);

        assertTrue(empty.tables().isEmpty());
        assertTrue(empty.donationMapping().orElseThrow().isEmpty());
        assertTrue(failed.tables().isEmpty());
    }

    @Test
    void findsListsAtAnyDepth() {
        Object root = OrderedJsonReader.read("{\"a\": [{\"b\": {\"BlockList\": [1]}}]}");

        assertEquals(List.of(1), TikTokPlatform.findList(root, "BlockList"));
        assertNull(TikTokPlatform.findList(root, "FansList"));
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new TikTokPlatform(0));
    }
}
