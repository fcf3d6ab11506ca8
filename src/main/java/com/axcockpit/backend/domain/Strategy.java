package com.axcockpit.backend.domain;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Entity
@Table(name = "strategy",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_strategy_name_key", columnNames = {"name_key"})
        })
public class Strategy {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** 처음 등장한 표기 그대로(trim) */
    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /** 비교용 키: trim + 소문자 */
    @Column(name = "name_key", nullable = false, length = 100)
    private String nameKey;

    @Column(name = "description", length = 500)
    private String description;

    // 참조 중인 전략은 삭제 대신 deprecated 처리
    @Column(name = "deprecated", nullable = false)
    private boolean deprecated = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    protected Strategy() {}

    public Strategy(String name) {
        this.name = name.trim();
        this.nameKey = keyOf(name);
    }

    public static String keyOf(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public Map<String, Object> toAuditState() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", name);
        m.put("description", description);
        m.put("deprecated", deprecated);
        return m;
    }

    // --- getters/setters ---
    public Long getId() { return id; }

    public String getName() { return name; }

    public String getNameKey() { return nameKey; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isDeprecated() { return deprecated; }
    public void setDeprecated(boolean deprecated) { this.deprecated = deprecated; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    // equals/hashCode: nameKey 기준
    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Strategy that)) return false;
        return nameKey != null && nameKey.equals(that.nameKey);
    }
    @Override public int hashCode() { return nameKey == null ? 0 : nameKey.hashCode(); }
}
