package com.example.intel.service.news;

import com.example.intel.model.NewsItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RssParserTest {

    private static final String FEED =
            "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<rss version=\"2.0\"><channel><title>AAPL stock - Google News</title>\n"
            + "  <item>\n"
            + "    <title>Apple supplier shifts output to India</title>\n"
            + "    <link>https://news.example.com/a</link>\n"
            + "    <pubDate>Mon, 05 Jan 2026 14:30:00 GMT</pubDate>\n"
            + "    <source url=\"https://www.reuters.com\">Reuters</source>\n"
            + "  </item>\n"
            + "  <item>\n"
            + "    <title> </title>\n"
            + "    <link>https://news.example.com/empty</link>\n"
            + "  </item>\n"
            + "  <item>\n"
            + "    <title>Microsoft raises capex</title>\n"
            + "    <link>https://news.example.com/b</link>\n"
            + "    <pubDate>not a date</pubDate>\n"
            + "  </item>\n"
            + "</channel></rss>\n";

    @Test
    void parsesItems() {
        List<NewsItem> items = RssParser.parse(FEED);

        assertEquals(2, items.size());
        NewsItem first = items.get(0);
        assertEquals("Apple supplier shifts output to India", first.getTitle());
        assertEquals("Reuters", first.getSource());
        assertEquals("https://news.example.com/a", first.getUrl());
        assertEquals(Instant.parse("2026-01-05T14:30:00Z"), first.getPublishedAt());

        NewsItem second = items.get(1);
        assertEquals("", second.getSource());
        assertNull(second.getPublishedAt());
    }

    @Test
    void garbageYieldsEmptyList() {
        assertTrue(RssParser.parse("<html><body>blocked</body>").isEmpty());
        assertTrue(RssParser.parse("").isEmpty());
        assertTrue(RssParser.parse(null).isEmpty());
    }
}
