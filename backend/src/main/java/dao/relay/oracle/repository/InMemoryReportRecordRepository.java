package dao.relay.oracle.repository;

import dao.relay.oracle.model.ReportRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryReportRecordRepository implements ReportRecordRepository {

    // key: lower-case stash account
    private final Map<String, ReportRecord> recordsByStash = new ConcurrentHashMap<>();

    @Override
    public void save(ReportRecord record) {
        recordsByStash.put(key(record.stashAccount()), record);
    }

    @Override
    public Optional<ReportRecord> findByStash(String stashAccount) {
        return Optional.ofNullable(recordsByStash.get(key(stashAccount)));
    }

    @Override
    public List<ReportRecord> findAll() {
        return new ArrayList<>(recordsByStash.values());
    }

    private static String key(String stashAccount) {
        return stashAccount.toLowerCase(Locale.ROOT);
    }
}
