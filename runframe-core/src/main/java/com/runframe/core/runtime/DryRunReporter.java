package com.runframe.core.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.runframe.api.exception.RunFrameException;
import com.runframe.core.suite.Suite;
import com.runframe.core.suite.Test;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 干跑报告
 * <p>
 * 格式：{@code {"stats": {...}, "tests": [{"title", "fullTitle", "file"}]}}
 */
@Slf4j
public class DryRunReporter {

    private final ObjectMapper objectMapper;

    public DryRunReporter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public DryRunReporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode buildReport(Suite root) {
        List<Test> tests = root.allTests();

        ObjectNode report = objectMapper.createObjectNode();
        ObjectNode stats = report.putObject("stats");
        stats.put("suites", countSuites(root));
        stats.put("tests", tests.size());
        stats.put("passes", 0);
        stats.put("pending", 0);
        stats.put("failures", 0);

        ArrayNode testNodes = report.putArray("tests");
        for (Test test : tests) {
            ObjectNode node = testNodes.addObject();
            node.put("title", test.getTitle());
            node.put("fullTitle", test.fullTitle());
            node.put("file", test.getFile());
        }
        return report;
    }

    /**
     * 写出报告，自动创建父目录
     */
    public void write(Suite root, Path output) {
        ObjectNode report = buildReport(root);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(output.toFile(), report);
        } catch (IOException e) {
            throw new RunFrameException("Unable to write dry run report to [" + output + "]", e);
        }
        log.info("Dry run results with {} tests stored in {}", report.get("tests").size(), output);
    }

    private static int countSuites(Suite suite) {
        int count = 0;
        for (Suite child : suite.getSuites()) {
            count += 1 + countSuites(child);
        }
        return count;
    }
}
