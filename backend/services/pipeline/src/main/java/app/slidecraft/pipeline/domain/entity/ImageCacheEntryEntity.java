package app.slidecraft.pipeline.domain.entity;

import app.slidecraft.pipeline.domain.model.ImageCacheEntry;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;

@Entity
@Table(name = "image_cache_entries", schema = "app_pipeline")
public class ImageCacheEntryEntity {

    @Id
    @Column(name = "cache_key", nullable = false, length = 64)
    private String cacheKey;

    @Column(name = "blob_key", nullable = false)
    private String blobKey;

    @Column(name = "placeholder", nullable = false)
    private boolean placeholder;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at")
    private Instant expiresAt;

    public ImageCacheEntryEntity() {
    }

    public static ImageCacheEntryEntity from(ImageCacheEntry entry) {
        ImageCacheEntryEntity entity = new ImageCacheEntryEntity();
        entity.apply(entry);
        return entity;
    }

    public void apply(ImageCacheEntry entry) {
        this.cacheKey = entry.cacheKey();
        this.blobKey = entry.blobKey();
        this.placeholder = entry.placeholder();
        this.createdAt = entry.createdAt();
        this.expiresAt = entry.expiresAt();
    }

    public ImageCacheEntry toEntry() {
        return new ImageCacheEntry(cacheKey, blobKey, placeholder, createdAt, expiresAt);
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public String getBlobKey() {
        return blobKey;
    }

    public void setBlobKey(String blobKey) {
        this.blobKey = blobKey;
    }

    public boolean isPlaceholder() {
        return placeholder;
    }

    public void setPlaceholder(boolean placeholder) {
        this.placeholder = placeholder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }
}
