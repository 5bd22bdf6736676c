package com.realtime.connect.directory.repository;

import com.realtime.connect.directory.entity.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    // 나를 제외한 전체 (디렉터리 순서 = username)
    @Query("select u from User u where u.id <> :me order by u.username asc")
    List<User> findOthers(@Param("me") UUID me, Pageable pageable);

    @Query("select u from User u where u.id <> :me and lower(u.currentMood) = :mood order by u.username asc")
    List<User> findOthersByMood(@Param("me") UUID me, @Param("mood") String mood, Pageable pageable);
}
