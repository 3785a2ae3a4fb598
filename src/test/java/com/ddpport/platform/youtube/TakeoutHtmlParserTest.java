package com.ddpport.platform.youtube;

import com.ddpport.core.table.TimestampNormalizer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TakeoutHtmlParserTest {

    @Test
    void parsesWatchedVideo() {
        String html = TakeoutHtml.page(TakeoutHtml.watched("Cat video", "https://www.youtube.com/watch?v=abc&amp;t=1",
                "Cat Channel", "Jan 5, 2023, 3:04:05\u202FPM CET"));

        List<TakeoutHtmlParser.Activity> activities = TakeoutHtmlParser.parse(html);

        assertEquals(1, activities.size());
        TakeoutHtmlParser.Activity activity = activities.get(0);
        assertEquals("Cat video", activity.title());
        assertEquals("https://www.youtube.com/watch?v=abc&t=1", activity.url());
        assertEquals("Cat Channel", activity.channel());
        assertFalse(activity.advertisement());
        assertEquals("Jan 5, 2023, 3:04:05PM CET", activity.date());
    }

    @Test
    void dateDropsNonAsciiCharactersWithoutSpacing() {
        String html = TakeoutHtml.page(TakeoutHtml.watched("Cat video", "https://www.youtube.com/watch?v=abc",
                "Cat Channel", "Jan 5, 2023, 10:15:30\u202FPM CET"));

        TakeoutHtmlParser.Activity activity = TakeoutHtmlParser.parse(html).get(0);

        assertEquals("Jan 5, 2023, 10:15:30PM CET", activity.date());
        assertEquals("2023-01-05T22:15:30", TimestampNormalizer.toIso8601(activity.date()));
    }

    @Test
    void flagsAdvertisementsAndMissingChannel() {
        String html = TakeoutHtml.page(TakeoutHtml.watchedAd("Buy now", "https://www.youtube.com/watch?v=ad",
                "Jan 6, 2023, 1:00:00 AM CET"));

        TakeoutHtmlParser.Activity activity = TakeoutHtmlParser.parse(html).get(0);

        assertTrue(activity.advertisement());
        assertNull(activity.channel());
        assertEquals("Buy now", activity.title());
    }

    @Test
    void entryWithoutLinkUsesFirstText() {
        String html = TakeoutHtml.page(TakeoutHtml.cell(
                "Watched a video that has been removed<br>Jan 7, 2023, 9:00:00 AM CET", ""));

        TakeoutHtmlParser.Activity activity = TakeoutHtmlParser.parse(html).get(0);

        assertEquals("Watched a video that has been removed", activity.title());
        assertNull(activity.url());
        assertEquals("Jan 7, 2023, 9:00:00 AM CET", activity.date());
    }

    @Test
    void keepsDocumentOrderAndSkipsCellsWithoutContent() {
        String html = TakeoutHtml.page(
                TakeoutHtml.searched("cats", "Jan 1, 2023, 1:00:00 PM CET"),
                "<div class=\"outer-cell mdl-cell mdl-cell--12-col mdl-shadow--2dp\"><p>empty</p></div>",
                TakeoutHtml.searched("dogs", "Jan 2, 2023, 1:00:00 PM CET"));

        List<TakeoutHtmlParser.Activity> activities = TakeoutHtmlParser.parse(html);

        assertEquals(List.of("cats", "dogs"), activities.stream().map(TakeoutHtmlParser.Activity::title).toList());
    }

    @Test
    void unescapesEntities() {
        assertEquals("Tom & Jerry's \"best\" <3", TakeoutHtmlParser.unescape("Tom &amp; Jerry&#39;s &quot;best&quot; &lt;3"));
        assertEquals("caf\u00E9", TakeoutHtmlParser.unescape("caf&#xe9;"));
    }
}
