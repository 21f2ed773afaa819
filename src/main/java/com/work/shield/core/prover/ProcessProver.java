package com.work.shield.core.prover;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.shield.core.exception.ProverFailureException;
import com.work.shield.core.model.ProofRequest;
import com.work.shield.core.model.ProofResult;
import com.work.shield.core.prover.wire.ProgressPayload;
import com.work.shield.core.prover.wire.ProverResponsePayload;
import com.work.shield.core.prover.wire.ProverWire;
import com.work.shield.core.queue.JobStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import static com.work.shield.core.support.ValidationUtils.requireNonEmpty;
import static com.work.shield.core.support.ValidationUtils.requireNonNull;

/**
 * 子进程证明器：请求 JSON 写入 stdin，结果 JSON 从 stdout 读取。
 * <p>
 * stderr 上以 '{' 开头的行按 {@link ProgressPayload} 解析为结构化进度事件，
 * 其余行进入诊断尾巴（最后 2000 字符），失败时随错误一起返回。
 * </p>
 */
public class ProcessProver implements Prover, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessProver.class);

    private static final int STDOUT_PREVIEW = 500;

    private final List<String> command;
    private final File workingDirectory;
    private final Map<String, String> environment;
    private final ObjectMapper objectMapper;
    private final ExecutorService ioExecutor;
    private final Map<ProverHandle, ProverExecution> executions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ProcessProver(List<String> command, File workingDirectory, Map<String, String> environment,
                         ObjectMapper objectMapper) {
        requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command 不能为空");
        }
        requireNonEmpty(command.get(0), "command[0]");
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.workingDirectory = workingDirectory;
        this.environment = environment == null ? Collections.<String, String>emptyMap() : new HashMap<>(environment);
        this.objectMapper = requireNonNull(objectMapper, "objectMapper");
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("prover-io-" + t.getId());
            t.setDaemon(true);
            return t;
        };
        this.ioExecutor = Executors.newCachedThreadPool(tf);
    }

    @Override
    public ProverHandle submit(ProofRequest request) {
        requireNonNull(request, "request");
        ProverHandle handle = new ProverHandle("proc-" + sequence.incrementAndGet());
        ProverExecution execution = new ProverExecution();
        executions.put(handle, execution);

        byte[] input;
        try {
            input = objectMapper.writeValueAsBytes(ProverWire.toPayload(request));
        } catch (JsonProcessingException e) {
            execution.fail(ProverFailureReason.PROCESS_ERROR, "cannot serialize request: " + e.getOriginalMessage());
            return handle;
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory);
        }
        builder.environment().putAll(environment);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("prover process start failed handle={} command={} err={}", handle.getId(), command, e.getMessage());
            execution.fail(ProverFailureReason.PROCESS_ERROR, String.valueOf(e.getMessage()));
            return handle;
        }
        log.info("prover process started handle={} requestBytes={}", handle.getId(), input.length);
        ioExecutor.execute(() -> run(handle, process, input, execution));
        return handle;
    }

    @Override
    public ProverStatus poll(ProverHandle handle) {
        ProverExecution execution = executions.get(handle);
        if (execution == null) {
            throw new ProverFailureException("unknown prover handle " + handle);
        }
        ProverStatus status = execution.snapshot();
        if (status.isTerminal()) {
            executions.remove(handle);
        }
        return status;
    }

    private void run(ProverHandle handle, Process process, byte[] input, ProverExecution execution) {
        Future<?> stderrReader = ioExecutor.submit(() -> readProgress(handle, process.getErrorStream(), execution));
        try {
            writeRequest(handle, process, input, execution);
            String stdout = readFully(process.getInputStream());
            int exitCode = process.waitFor();
            stderrReader.get();
            if (exitCode != 0) {
                log.warn("prover exited handle={} code={}", handle.getId(), exitCode);
                execution.fail(ProverFailureReason.NONZERO_EXIT, String.valueOf(exitCode));
                return;
            }
            execution.succeed(parseResponse(stdout, execution));
            log.info("prover finished handle={}", handle.getId());
        } catch (ResponseParseException e) {
            log.warn("prover response unparseable handle={} err={}", handle.getId(), e.getMessage());
            execution.fail(ProverFailureReason.PARSE_ERROR, e.getMessage());
        } catch (IOException | ExecutionException e) {
            log.warn("prover process error handle={} err={}", handle.getId(), e.getMessage());
            process.destroy();
            execution.fail(ProverFailureReason.PROCESS_ERROR, String.valueOf(e.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            execution.fail(ProverFailureReason.PROCESS_ERROR, "interrupted");
        }
    }

    /**
     * 进程提前退出时写 stdin 会断管；此时不算失败，退出码仍由 waitFor 决定。
     */
    private void writeRequest(ProverHandle handle, Process process, byte[] input, ProverExecution execution) {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(input);
        } catch (IOException e) {
            log.warn("prover stdin write failed handle={} alive={} err={}", handle.getId(), process.isAlive(),
                    e.getMessage());
            execution.tail().append("stdin write failed: " + e.getMessage());
        }
    }

    private ProofResult parseResponse(String stdout, ProverExecution execution) throws ResponseParseException {
        try {
            ProverResponsePayload payload = objectMapper.readValue(stdout.trim(), ProverResponsePayload.class);
            return ProverWire.fromPayload(payload);
        } catch (IOException | IllegalArgumentException e) {
            execution.tail().append("stdout: " + stdout.substring(0, Math.min(STDOUT_PREVIEW, stdout.length())));
            throw new ResponseParseException(e.getMessage());
        }
    }

    private static final class ResponseParseException extends Exception {
        ResponseParseException(String message) {
            super(message);
        }
    }

    private void readProgress(ProverHandle handle, InputStream stderr, ProverExecution execution) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                ProgressEvent event = parseProgress(line);
                if (event != null) {
                    execution.progress(event);
                    log.debug("prover progress handle={} stage={} progress={}", handle.getId(),
                            event.getStage(), event.getProgress());
                } else {
                    execution.tail().append(line);
                }
            }
        } catch (IOException e) {
            execution.tail().append("stderr read failed: " + e.getMessage());
        }
    }

    /**
     * @return 结构化进度事件；不是合法事件时返回 null，该行作为诊断输出
     */
    ProgressEvent parseProgress(String line) {
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            ProgressPayload payload = objectMapper.readValue(trimmed, ProgressPayload.class);
            if (payload.getStage() == null) {
                return null;
            }
            JobStage stage = JobStage.valueOf(payload.getStage().trim().toUpperCase(Locale.ROOT));
            if (!stage.isActive()) {
                return null;
            }
            int progress = payload.getProgress() == null ? 0 : payload.getProgress();
            return new ProgressEvent(stage, progress, payload.getMessage());
        } catch (IOException | IllegalArgumentException e) {
            return null;
        }
    }

    private static String readFully(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        int n;
        while ((n = in.read(buffer)) != -1) {
            out.write(buffer, 0, n);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Override
    public void close() {
        ioExecutor.shutdownNow();
    }
}
