package com.btcdirection.feature.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A collected news article. {@code sentimentScore} stays {@code null} until the
 * scoring pass succeeds for it.
 */
@Data
@NoArgsConstructor
@Table("news_article")
public class NewsArticle {

    @Id
    private Long id;

    private LocalDate     publishedDate;
    private String        url;
    private String        title;
    private String        content;
    private Double        sentimentScore;
    private LocalDateTime scoredAt;
}
