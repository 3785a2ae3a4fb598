package com.ddpport.platform.youtube;

import com.ddpport.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scrapes the activity pages of a Google Takeout export ({@code watch-history.html}, {@code search-history.html}
 * and their translations). Each activity lives in an outer cell holding a content cell with links and a
 * trailing date, plus a caption cell naming the product, which mentions Google Ads for advertisements.
 */
final class TakeoutHtmlParser {
    private static final Logger LOGGER = AppLogger.get();

    private static final String OUTER_CELL = "<div class=\"outer-cell mdl-cell mdl-cell--12-col mdl-shadow--2dp\">";
    private static final Pattern CONTENT_CELL = Pattern.compile(
            "<div class=\"content-cell mdl-cell mdl-cell--6-col mdl-typography--body-1\">(.*?)</div>", Pattern.DOTALL);
    private static final Pattern CAPTION_CELL = Pattern.compile(
            "<div class=\"content-cell mdl-cell mdl-cell--12-col mdl-typography--caption\">(.*?)</div>", Pattern.DOTALL);
    private static final Pattern ANCHOR = Pattern.compile(
            "<a\\s[^>]*?href=\"([^\"]*)\"[^>]*>(.*?)</a>", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern NUMERIC_ENTITY = Pattern.compile("&#(x?)([0-9a-fA-F]+);");
    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");

    private TakeoutHtmlParser() {
    }

    static List<Activity> parse(String html) {
        List<Activity> activities = new ArrayList<>();
        String[] cells = html.split(Pattern.quote(OUTER_CELL));
        for (int i = 1; i < cells.length; i++) {
            Activity activity = parseCell(cells[i]);
            if (activity != null) {
                activities.add(activity);
            }
        }
        return activities;
    }

    private static Activity parseCell(String cell) {
        Matcher content = CONTENT_CELL.matcher(cell);
        if (!content.find()) {
            LOGGER.fine("Skipping activity without content cell");
            return null;
        }
        String body = content.group(1);

        Matcher caption = CAPTION_CELL.matcher(cell);
        boolean advertisement = false;
        if (caption.find()) {
            String captionText = unescape(TAG.matcher(caption.group(1)).replaceAll(""));
            advertisement = captionText.contains("Google Ads") || captionText.contains("Google Adverteren");
        }

        List<String> links = new ArrayList<>();
        List<String> linkTexts = new ArrayList<>();
        Matcher anchor = ANCHOR.matcher(body);
        while (anchor.find()) {
            links.add(unescape(anchor.group(1)));
            linkTexts.add(unescape(TAG.matcher(anchor.group(2)).replaceAll("")).trim());
        }

        List<String> texts = directTexts(ANCHOR.matcher(body).replaceAll("<a/>"));
        String date = texts.isEmpty() ? "" : asciiOnly(texts.remove(texts.size() - 1));

        String title;
        String url;
        if (!links.isEmpty()) {
            title = linkTexts.get(0);
            url = links.get(0);
        } else {
            title = texts.isEmpty() ? null : texts.get(0);
            url = null;
            LOGGER.fine("Could not find a title link");
        }
        String channel = linkTexts.size() > 1 ? linkTexts.get(1) : null;
        return new Activity(title, url, channel, advertisement, date);
    }

    private static List<String> directTexts(String markup) {
        List<String> texts = new ArrayList<>();
        for (String part : TAG.split(markup)) {
            String text = unescape(part).trim();
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    static String asciiOnly(String text) {
        return NON_ASCII.matcher(text).replaceAll("").trim();
    }

    static String unescape(String text) {
        Matcher numeric = NUMERIC_ENTITY.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (numeric.find()) {
            int radix = numeric.group(1).isEmpty() ? 10 : 16;
            String replacement;
            try {
                replacement = new String(Character.toChars(Integer.parseInt(numeric.group(2), radix)));
            } catch (IllegalArgumentException ex) {
                replacement = numeric.group();
            }
            numeric.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        numeric.appendTail(sb);
        return sb.toString()
                .replace("&nbsp;", "\u00A0")
                .replace("&emsp;", "\u2003")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
    }

    /**
     * One entry of an activity page. {@code title}, {@code url} and {@code channel} may be null.
     */
    record Activity(String title, String url, String channel, boolean advertisement, String date) {
    }
}
