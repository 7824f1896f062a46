package com.example.microscopy.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;

/**
 * 调外部解码进程（例如基于 HyperSpy 的脚本）把 .dm3/.dm4/.emd 等二进制文件转成 JSON。
 *
 * 命令来自 decoder.command，其中的 {file} 替换成文件的绝对路径；
 * stdout 是 JSON，stderr 只用于排错。
 */
@Component
public class ExternalProcessDecoder implements DatasetDecoder {

    private static final Logger log = LoggerFactory.getLogger(ExternalProcessDecoder.class);

    private final DecoderProperties props;
    private final DatasetJsonReader reader;

    public ExternalProcessDecoder(DecoderProperties props, DatasetJsonReader reader) {
        this.props = props;
        this.reader = reader;
    }

    @Override
    public List<DecodedDataset> decode(Path file) {
        if (file == null || !Files.exists(file)) {
            throw new DatasetDecodeException("Input file not found: " + file);
        }
        List<String> cmd = buildCommand(file);

        ProcessBuilder pb = new ProcessBuilder(cmd);
        pb.environment().putAll(props.getEnvironment());
        if (props.getWorkDir() != null && !props.getWorkDir().isBlank()) {
            pb.directory(Path.of(props.getWorkDir()).toFile());
        }
        // stdout 要整段解析成 JSON，stderr 单独收
        pb.redirectErrorStream(false);

        log.debug("Running decoder: {}", String.join(" ", cmd));

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new DatasetDecodeException("Failed to start decoder: " + cmd.get(0), e);
        }

        // stdout / stderr 都在后台线程里读，超时只由 waitFor 控制
        FutureTask<String> out = drain(p.getInputStream(), "decoder-stdout");
        FutureTask<String> err = drain(p.getErrorStream(), "decoder-stderr");

        try {
            int code = waitFor(p, file);
            String stderr = err.get();
            if (code != 0) {
                throw new DatasetDecodeException("Decoder failed (exit=" + code + ") for " + file + "\n" + stderr);
            }
            if (!stderr.isEmpty()) {
                log.debug("Decoder stderr for {}:\n{}", file, stderr);
            }
            return reader.read(out.get(), file.toString());
        } catch (ExecutionException e) {
            p.destroyForcibly();
            throw new DatasetDecodeException("Failed to read decoder output for " + file, e.getCause());
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DatasetDecodeException("Interrupted while decoding " + file, e);
        }
    }

    List<String> buildCommand(Path file) {
        List<String> template = props.getCommand();
        if (template == null || template.isEmpty()) {
            throw new DatasetDecodeException("decoder.command is empty");
        }
        String abs = file.toAbsolutePath().normalize().toString();
        List<String> cmd = new ArrayList<>(template.size());
        for (String arg : template) {
            cmd.add(arg.replace(DecoderProperties.FILE_PLACEHOLDER, abs));
        }
        return cmd;
    }

    private int waitFor(Process p, Path file) throws InterruptedException {
        long timeout = props.getTimeoutSeconds();
        if (timeout <= 0) {
            return p.waitFor();
        }
        if (!p.waitFor(timeout, TimeUnit.SECONDS)) {
            p.destroyForcibly();
            throw new DatasetDecodeException("Decoder timed out after " + timeout + "s for " + file);
        }
        return p.exitValue();
    }

    private static FutureTask<String> drain(InputStream in, String threadName) {
        FutureTask<String> task = new FutureTask<>(() -> {
            try (InputStream is = in) {
                return new String(is.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        Thread t = new Thread(task, threadName);
        t.setDaemon(true);
        t.start();
        return task;
    }
}
