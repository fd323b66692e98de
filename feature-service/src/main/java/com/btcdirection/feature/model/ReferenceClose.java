package com.btcdirection.feature.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

/**
 * Close of a reference asset (e.g. {@code nasdaq}) on a day it traded.
 * Non-trading days have no row.
 */
@Data
@NoArgsConstructor
@Table("reference_close")
public class ReferenceClose {

    @Id
    private Long id;

    private String    asset;
    private LocalDate obsDate;
    private double    close;
}
