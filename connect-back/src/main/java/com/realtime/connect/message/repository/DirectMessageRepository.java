package com.realtime.connect.message.repository;

import com.realtime.connect.message.entity.DirectMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface DirectMessageRepository extends JpaRepository<DirectMessage, Long>, DirectMessageRepositoryCustom {

    @Modifying
    @Query("delete from DirectMessage m where m.pairLow = :low and m.pairHigh = :high")
    int deleteThread(@Param("low") UUID low, @Param("high") UUID high);
}
