package dao.relay.oracle.repository;

import dao.relay.oracle.model.ReportRecord;

import java.util.List;
import java.util.Optional;

public interface ReportRecordRepository {

    void save(ReportRecord record);

    Optional<ReportRecord> findByStash(String stashAccount);

    List<ReportRecord> findAll();
}
