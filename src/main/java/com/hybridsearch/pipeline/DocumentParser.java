package com.hybridsearch.pipeline;

import com.hybridsearch.config.PipelineProperties;
import com.hybridsearch.exception.PipelineStageException;
import com.hybridsearch.model.ParsedCorpus;
import com.hybridsearch.model.ParsedDocument;
import com.hybridsearch.model.RawDocument;
import com.hybridsearch.text.Tokenizer;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiConsumer;

/**
 * Extracts doc id, terms and outgoing links from raw HTML. Markup is parsed best-effort; a
 * document without a usable doc id is skipped, never fatal.
 */
@Slf4j
@Component
public class DocumentParser {

    private record PageExtract(int docId, String url, List<String> terms, SortedSet<String> links, int records) {}

    private final MapReduceExecutor mapReduce;
    private final Tokenizer tokenizer;
    private final String docIdAttribute;

    @Autowired
    public DocumentParser(MapReduceExecutor mapReduce, Tokenizer tokenizer, PipelineProperties properties) {
        this(mapReduce, tokenizer, properties.docidAttribute());
    }

    public DocumentParser(MapReduceExecutor mapReduce, Tokenizer tokenizer, String docIdAttribute) {
        this.mapReduce = mapReduce;
        this.tokenizer = tokenizer;
        this.docIdAttribute = docIdAttribute;
    }

    public ParsedCorpus parse(List<RawDocument> crawl) {
        if (crawl == null) {
            throw new PipelineStageException(PipelineStage.DOCUMENT_PARSER, "crawl input is missing");
        }

        List<PageExtract> extracts = mapReduce.run("document-parser", crawl, this::extract, this::merge);

        Map<String, Integer> docIdByUrl = new HashMap<>();
        for (PageExtract extract : extracts) {
            if (!extract.url().isEmpty()) {
                docIdByUrl.putIfAbsent(extract.url(), extract.docId());
            }
        }

        List<ParsedDocument> documents = new ArrayList<>(extracts.size());
        int records = 0;
        for (PageExtract extract : extracts) {
            SortedSet<Integer> outlinks = new TreeSet<>();
            for (String link : extract.links()) {
                Integer target = docIdByUrl.get(link);
                if (target != null && target != extract.docId()) {
                    outlinks.add(target);
                }
            }
            documents.add(new ParsedDocument(extract.docId(), extract.url(), extract.terms(), outlinks));
            records += extract.records();
        }

        int skipped = crawl.size() - records;
        log.info("Parsed {} documents, skipped {}", documents.size(), skipped);
        return new ParsedCorpus(documents, skipped);
    }

    private void extract(RawDocument raw, BiConsumer<Integer, PageExtract> emit) {
        try {
            Document html = Jsoup.parse(raw.markup());
            Optional<Integer> docId = docIdOf(html);
            if (docId.isEmpty()) {
                log.warn("Skipping document #{} of {}: no '{}' doc id", raw.ordinal(), raw.source(), docIdAttribute);
                return;
            }

            String url = urlOf(html);
            if (!url.isEmpty()) {
                html.setBaseUri(url);
            }

            SortedSet<String> links = new TreeSet<>();
            for (Element anchor : html.select("a[href]")) {
                String target = normalizeUrl(anchor.absUrl("href"));
                if (!target.isEmpty()) {
                    links.add(target);
                }
            }

            List<String> terms = tokenizer.tokenize(html.text());
            emit.accept(docId.get(), new PageExtract(docId.get(), url, terms, links, 1));
        } catch (RuntimeException e) {
            log.warn("Skipping document #{} of {}: {}", raw.ordinal(), raw.source(), e.getMessage());
        }
    }

    private PageExtract merge(Integer docId, List<PageExtract> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        log.warn("Doc id {} appears in {} crawl records, merging", docId, parts.size());

        String url = "";
        List<String> terms = new ArrayList<>();
        SortedSet<String> links = new TreeSet<>();
        for (PageExtract part : parts) {
            if (url.isEmpty()) {
                url = part.url();
            }
            terms.addAll(part.terms());
            links.addAll(part.links());
        }
        return new PageExtract(docId, url, terms, links, parts.size());
    }

    private Optional<Integer> docIdOf(Document html) {
        Element meta = html.selectFirst("meta[" + docIdAttribute + "]");
        String value = meta != null ? meta.attr(docIdAttribute) : null;
        if (value == null) {
            Element named = html.selectFirst("meta[name=" + docIdAttribute + "]");
            value = named != null ? named.attr("content") : null;
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private String urlOf(Document html) {
        Element canonical = html.selectFirst("link[rel=canonical][href]");
        if (canonical != null) {
            return normalizeUrl(canonical.attr("href"));
        }
        Element ogUrl = html.selectFirst("meta[property=og:url][content]");
        return ogUrl != null ? normalizeUrl(ogUrl.attr("content")) : "";
    }

    private static String normalizeUrl(String url) {
        if (url == null) {
            return "";
        }
        int fragment = url.indexOf('#');
        return (fragment >= 0 ? url.substring(0, fragment) : url).trim();
    }
}
