package com.repurpose.analysis.service.reference;

/**
 * One row of the medicine reference dataset.
 */
public record MedicineRow(String name,
                          String category,
                          String dosageForm,
                          String strength,
                          String manufacturer,
                          String indication,
                          String classification) {
}
