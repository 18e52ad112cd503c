package dao.relay.oracle.service;

import dao.relay.oracle.model.ReportRecord;
import dao.relay.oracle.model.ReportedEra;
import dao.relay.oracle.parachain.OracleContract;
import dao.relay.oracle.parachain.ParachainGateway;
import dao.relay.oracle.repository.ReportRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Last era reported per stash, seeded from the oracle contract.
 * Guarantees no (stash, era) pair is submitted twice.
 */
@Slf4j
@Service
public class ReportTracker {

    private final ReportRecordRepository repository;
    private final OracleContract contract;

    public ReportTracker(ReportRecordRepository repository, OracleContract contract) {
        this.repository = repository;
        this.contract = contract;
    }

    public void initialize(ParachainGateway gateway, List<String> stashes) {
        for (String stash : stashes) {
            refresh(gateway, stash);
        }
        log.info("Report tracker initialized for {} stashes: {}", stashes.size(), snapshot());
    }

    /**
     * Seeds a stash from the contract the first time it is seen.
     */
    public void ensureKnown(ParachainGateway gateway, String stash) {
        if (repository.findByStash(stash).isEmpty()) {
            refresh(gateway, stash);
        }
    }

    public boolean isAlreadyReported(String stash, long eraId) {
        return repository.findByStash(stash)
                .map(r -> eraId <= r.lastReportedEra())
                .orElse(false);
    }

    public void markReported(String stash, long eraId) {
        long current = lastReportedEra(stash).orElse(-1L);
        if (eraId <= current) {
            log.warn("Ignoring report mark for stash {} era {}: already at era {}", stash, eraId, current);
            return;
        }
        repository.save(new ReportRecord(stash, eraId));
    }

    public OptionalLong lastReportedEra(String stash) {
        return repository.findByStash(stash)
                .map(r -> OptionalLong.of(r.lastReportedEra()))
                .orElse(OptionalLong.empty());
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> view = new TreeMap<>();
        for (ReportRecord r : repository.findAll()) {
            view.put(r.stashAccount(), r.lastReportedEra());
        }
        return view;
    }

    /**
     * Re-reads the contract record of a stash. The local record only moves forward.
     */
    public void refresh(ParachainGateway gateway, String stash) {
        ReportedEra onChain = contract.isReportedLastEra(gateway, stash);
        long effective = onChain.effectiveLastReported();
        long local = lastReportedEra(stash).orElse(-1L);
        long value = Math.max(local, effective);
        repository.save(new ReportRecord(stash, value));
        log.debug("Stash {}: contract era {} reported={} -> last reported {}",
                stash, onChain.eraId(), onChain.reported(), value);
    }
}
