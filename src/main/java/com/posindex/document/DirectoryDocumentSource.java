package com.posindex.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 从目录读取已分词文本：每个 .txt 文件为一个文档，文件名即文档标识，内容按空白切分。
 */
public final class DirectoryDocumentSource implements DocumentSource {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryDocumentSource.class);
    private static final String TOKENIZED_SUFFIX = ".txt";

    private final Path directory;

    public DirectoryDocumentSource(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("分词目录不能为空");
        }
        this.directory = directory;
    }

    @Override
    public List<TokenizedDocument> documents() throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("分词目录不存在: " + directory.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().endsWith(TOKENIZED_SUFFIX))
                .sorted()
                .toList();
        }

        List<TokenizedDocument> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            documents.add(TokenizedDocument.ofText(file.getFileName().toString(), content));
        }
        logger.info("读取分词文档 {} 个: {}", documents.size(), directory);
        return documents;
    }
}
