package io.github.drompincen.boardpilot.runtime.usage;

public interface UsageSink {

    void record(UsageRecord usage);
}
