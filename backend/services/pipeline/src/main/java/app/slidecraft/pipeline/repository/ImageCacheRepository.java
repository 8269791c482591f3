package app.slidecraft.pipeline.repository;

import app.slidecraft.pipeline.domain.entity.ImageCacheEntryEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface ImageCacheRepository extends JpaRepository<ImageCacheEntryEntity, String> {

    List<ImageCacheEntryEntity> findByExpiresAtLessThanEqualOrderByExpiresAtAsc(Instant now, Pageable pageable);

    @Transactional
    @Modifying
    @Query("delete from ImageCacheEntryEntity e where e.cacheKey = :cacheKey and e.expiresAt <= :now")
    int deleteExpired(@Param("cacheKey") String cacheKey, @Param("now") Instant now);
}
