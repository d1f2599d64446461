package com.phillippitts.podcaster.testutil;

import com.phillippitts.podcaster.service.tts.SpeechOptions;
import com.phillippitts.podcaster.service.tts.SpeechSynthesizer;
import com.phillippitts.podcaster.service.tts.TtsProvider;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Speech provider double that returns {@code "audio:<voice>:<text>"} as bytes.
 *
 * <p>Lines registered with {@link #failOn(String)} throw; every call is recorded together with
 * the number of calls in flight so tests can check concurrency bounds.
 */
public class FakeSpeechSynthesizer implements SpeechSynthesizer {

    public record Call(String text, String voice, String format) {
    }

    private final List<Call> calls = new CopyOnWriteArrayList<>();
    private final Set<String> failingLines = ConcurrentHashMap.newKeySet();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile TtsProvider provider = TtsProvider.OPENAI;
    private volatile long latencyMillis;

    public FakeSpeechSynthesizer failOn(String line) {
        failingLines.add(line);
        return this;
    }

    public FakeSpeechSynthesizer withLatency(long millis) {
        this.latencyMillis = millis;
        return this;
    }

    public void setProvider(TtsProvider provider) {
        this.provider = provider;
    }

    @Override
    public byte[] synthesize(String text, SpeechOptions options) {
        int current = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(current, Math::max);
        try {
            calls.add(new Call(text, options.voice(), options.format()));
            if (latencyMillis > 0) {
                Thread.sleep(latencyMillis);
            }
            if (failingLines.contains(text)) {
                throw new IllegalStateException("provider rejected line");
            }
            return audioFor(options.voice(), text);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    @Override
    public TtsProvider activeProvider() {
        return provider;
    }

    public static byte[] audioFor(String voice, String text) {
        return ("audio:" + voice + ":" + text).getBytes(StandardCharsets.UTF_8);
    }

    public List<Call> calls() {
        return List.copyOf(calls);
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }
}
