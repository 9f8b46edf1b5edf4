package com.example.entitystore.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

@Table("entities")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityRecord {

    @Id
    @Column("id")
    private Long id;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("created_by")
    private String createdBy;

    @Column("data")
    private String data; // jsonb read back as text
}
