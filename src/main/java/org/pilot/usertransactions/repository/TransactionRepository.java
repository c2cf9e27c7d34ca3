package org.pilot.usertransactions.repository;

import org.pilot.usertransactions.entity.TransactionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TransactionRepository extends JpaRepository<TransactionRecord, Long> {

    // newest first; id breaks ties between rows created in the same millisecond
    @Query("select t from TransactionRecord t join User u on u.id = t.userId where u.id = :userId order by t.timestamp desc, t.id desc")
    List<TransactionRecord> findAllForUserNewestFirst(@Param("userId") Long userId);
}
