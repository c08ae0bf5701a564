package com.example.intel.service.news;

import com.example.intel.model.NewsItem;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

public final class RssParser {

    private RssParser() {}

    /** RSS 2.0 item 목록을 NewsItem으로. 파싱 불가 문서는 빈 목록 */
    public static List<NewsItem> parse(String xml) {
        if (xml == null || xml.isBlank()) return List.of();
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            Document doc = f.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
            NodeList items = doc.getElementsByTagName("item");
            List<NewsItem> out = new ArrayList<>(items.getLength());
            for (int i = 0; i < items.getLength(); i++) {
                Element e = (Element) items.item(i);
                String title = text(e, "title");
                if (title == null || title.isBlank()) continue;
                String source = text(e, "source");
                out.add(new NewsItem(title.trim(), source == null ? "" : source.trim(),
                        nvl(text(e, "link")), parseRfc1123(text(e, "pubDate"))));
            }
            return out;
        } catch (Exception ex) {
            return List.of();
        }
    }

    static Instant parseRfc1123(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(Element e, String tag) {
        NodeList nl = e.getElementsByTagName(tag);
        if (nl.getLength() == 0) return null;
        return nl.item(0).getTextContent();
    }

    private static String nvl(String s) {
        return s == null ? "" : s.trim();
    }
}
