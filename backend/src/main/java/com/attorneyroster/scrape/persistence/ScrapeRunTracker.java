package com.attorneyroster.scrape.persistence;

import com.attorneyroster.scrape.model.ScrapeRunUpdate;
import com.attorneyroster.scrape.model.ScrapeRunView;

import java.util.List;
import java.util.Optional;

public interface ScrapeRunTracker {

    long begin(String jurisdiction);

    void update(long runId, ScrapeRunUpdate update);

    Optional<ScrapeRunView> findRun(long runId);

    List<ScrapeRunView> findRecentRuns(int limit);

    List<ScrapeRunView> findRunningRuns();
}
