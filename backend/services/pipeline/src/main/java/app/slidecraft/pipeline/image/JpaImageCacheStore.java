package app.slidecraft.pipeline.image;

import app.slidecraft.pipeline.domain.entity.ImageCacheEntryEntity;
import app.slidecraft.pipeline.domain.model.ImageCacheEntry;
import app.slidecraft.pipeline.repository.ImageCacheRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
public class JpaImageCacheStore implements ImageCacheStore {

    private final ImageCacheRepository repository;

    public JpaImageCacheStore(ImageCacheRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<ImageCacheEntry> find(String cacheKey, Instant now) {
        return repository.findById(cacheKey)
                .map(ImageCacheEntryEntity::toEntry)
                .filter(entry -> !entry.isExpired(now));
    }

    @Override
    public ImageCacheEntry save(ImageCacheEntry entry) {
        Optional<ImageCacheEntryEntity> existing = repository.findById(entry.cacheKey());
        if (existing.isPresent()) {
            ImageCacheEntryEntity current = existing.get();
            if (!current.toEntry().isExpired(entry.createdAt())) {
                return current.toEntry();
            }
            current.apply(entry);
            return repository.saveAndFlush(current).toEntry();
        }
        try {
            return repository.saveAndFlush(ImageCacheEntryEntity.from(entry)).toEntry();
        } catch (DataIntegrityViolationException ex) {
            return repository.findById(entry.cacheKey())
                    .map(ImageCacheEntryEntity::toEntry)
                    .orElseThrow(() -> ex);
        }
    }

    @Override
    public List<ImageCacheEntry> findExpired(Instant now, int limit) {
        return repository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(now, PageRequest.of(0, limit)).stream()
                .map(ImageCacheEntryEntity::toEntry)
                .toList();
    }

    @Override
    public boolean deleteExpired(String cacheKey, Instant now) {
        return repository.deleteExpired(cacheKey, now) > 0;
    }
}
