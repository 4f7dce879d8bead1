package ru.marthastudios.nudgebot.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.marthastudios.nudgebot.entity.SmartGroupMember;

import java.util.List;

@Repository
public interface SmartGroupMemberRepository extends JpaRepository<SmartGroupMember, Long> {
    List<SmartGroupMember> findAllBySmartGroupIdOrderByIdAsc(String smartGroupId);
    @Modifying
    @Query("DELETE FROM SmartGroupMember m WHERE m.smartGroupId = :smartGroupId")
    void deleteAllBySmartGroupId(@Param("smartGroupId") String smartGroupId);
}
