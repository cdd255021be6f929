package com.cratepilot.app.repository;

import com.cratepilot.app.entity.Track;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TrackRepository extends JpaRepository<Track, String>, JpaSpecificationExecutor<Track> {

    @Query("SELECT t.id FROM Track t WHERE t.id IN :ids")
    List<String> findExistingIds(@Param("ids") Collection<String> ids);
}
