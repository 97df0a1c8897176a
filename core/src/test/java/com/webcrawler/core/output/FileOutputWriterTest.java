package com.webcrawler.core.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class FileOutputWriterTest {

    @TempDir
    Path tmp;

    @Test
    void record_format() {
        String rec = FileOutputWriter.formatRecord(URI.create("http://ex.test/a"), "body");
        String rule = "=".repeat(40);
        assertThat(rec).isEqualTo("\n\n" + rule + "\nURL: http://ex.test/a\n" + rule + "\nbody\n");
    }

    @Test
    void creates_directory_and_appends_across_writer_instances() throws Exception {
        Path out = tmp.resolve("crawled_pages");
        URI a = URI.create("http://ex.test/docs/a/1");
        URI b = URI.create("http://ex.test/docs/a/2");

        Path t1 = new FileOutputWriter(out, 3).write(a, "first");
        Path t2 = new FileOutputWriter(out, 3).write(b, "second");

        assertThat(t1).isEqualTo(t2).isEqualTo(out.resolve("ex.test_docs_a.txt"));
        String content = Files.readString(t1, StandardCharsets.UTF_8);
        assertThat(content)
                .isEqualTo(FileOutputWriter.formatRecord(a, "first") + FileOutputWriter.formatRecord(b, "second"));
    }

    @Test
    void concurrent_writes_to_same_file_do_not_interleave() throws Exception {
        FileOutputWriter w = new FileOutputWriter(tmp, 3);
        final int N = 50;
        String big = "x".repeat(20_000);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Path>> fs = new ArrayList<>();
        try {
            for (int i = 0; i < N; i++) {
                URI u = URI.create("http://ex.test/same/prefix/p" + i);
                fs.add(pool.submit(() -> w.write(u, big)));
            }
            for (Future<Path> f : fs) f.get();
        } finally {
            pool.shutdownNow();
        }

        String content = Files.readString(tmp.resolve("ex.test_same_prefix.txt"));
        Matcher m = Pattern.compile("URL: (\\S+)\n={40}\n(x+)\n").matcher(content);
        int records = 0;
        while (m.find()) {
            assertThat(m.group(2)).hasSize(big.length());
            records++;
        }
        assertThat(records).isEqualTo(N);
    }

    @Test
    void clean_removes_previous_output() throws Exception {
        Path out = tmp.resolve("pages");
        Files.createDirectories(out.resolve("nested"));
        Files.writeString(out.resolve("nested/old.txt"), "old");
        Files.writeString(out.resolve("old.txt"), "old");

        FileOutputWriter.clean(out);

        assertThat(out).isDirectory().isEmptyDirectory();
    }
}
