package com.hybridsearch.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Durable per-stage output of one pipeline run, one JSON document per line under
 * {@code <work-directory>/<version>/<checkpoint-name>.jsonl}.
 */
@Slf4j
public class StageCheckpoints {

    private static final byte[] NEWLINE = {'\n'};

    private final Path runDirectory;
    private final ObjectWriter writer;

    public StageCheckpoints(Path runDirectory, ObjectMapper objectMapper) {
        this.runDirectory = runDirectory;
        this.writer = objectMapper.writer();
    }

    public Path runDirectory() {
        return runDirectory;
    }

    public Path fileOf(PipelineStage stage) {
        return runDirectory.resolve(stage.checkpointName() + ".jsonl");
    }

    public Path write(PipelineStage stage, Collection<?> records) throws IOException {
        Files.createDirectories(runDirectory);
        Path file = fileOf(stage);

        try (FileChannel channel = FileChannel.open(file,
            StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            OutputStream out = Channels.newOutputStream(channel);
            for (Object record : records) {
                out.write(writer.writeValueAsBytes(record));
                out.write(NEWLINE);
            }
            out.flush();
            channel.force(true);
        }

        log.debug("Checkpoint {} written: {} records", file.getFileName(), records.size());
        return file;
    }

    public void deleteAll() throws IOException {
        if (!Files.exists(runDirectory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(runDirectory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        }
    }
}
