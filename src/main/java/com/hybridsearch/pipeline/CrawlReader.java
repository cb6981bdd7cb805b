package com.hybridsearch.pipeline;

import com.hybridsearch.model.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads crawl files in path order and splits them into raw documents. A file may hold several
 * documents, each starting with a doctype declaration; a file without one is a single document.
 */
@Slf4j
@Component
public class CrawlReader {

    private static final Pattern DOCUMENT_START = Pattern.compile("(?i)<!doctype\\s+html");

    public List<RawDocument> read(Path crawlDirectory) throws IOException {
        if (!Files.isDirectory(crawlDirectory)) {
            throw new NoSuchFileException(crawlDirectory.toString(), null, "crawl directory does not exist");
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(crawlDirectory)) {
            files = walk.filter(Files::isRegularFile)
                .sorted()
                .toList();
        }

        List<RawDocument> documents = new ArrayList<>();
        for (Path file : files) {
            String source = crawlDirectory.relativize(file).toString();
            List<String> markups = split(decode(Files.readAllBytes(file)));
            for (int i = 0; i < markups.size(); i++) {
                documents.add(new RawDocument(source, i, markups.get(i)));
            }
        }

        log.info("Read {} raw documents from {} crawl files in {}", documents.size(), files.size(), crawlDirectory);
        return documents;
    }

    static String decode(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.IGNORE)
            .onUnmappableCharacter(CodingErrorAction.IGNORE);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // unreachable with IGNORE actions
            throw new IllegalStateException("Lenient UTF-8 decoding failed", e);
        }
    }

    static List<String> split(String content) {
        if (content.isBlank()) {
            return List.of();
        }

        List<Integer> starts = new ArrayList<>();
        Matcher matcher = DOCUMENT_START.matcher(content);
        while (matcher.find()) {
            starts.add(matcher.start());
        }
        if (starts.isEmpty()) {
            return List.of(content);
        }

        List<String> documents = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : content.length();
            documents.add(content.substring(starts.get(i), end));
        }
        return documents;
    }
}
