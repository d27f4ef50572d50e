package com.actionplan.taskimport.service.pipeline.normalize;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Ambient values of one import call, passed explicitly so that the row transform stays pure.
 *
 * @param processedAt timestamp of the call; fallback creation date and createdAt/updatedAt
 * @param zone zone in which local dates and date-times of the workbook are anchored
 * @param referenceYear year whose century disambiguates two-digit years
 */
public record ImportContext(Instant processedAt, ZoneId zone, int referenceYear) {

  public static ImportContext of(Instant processedAt, ZoneId zone) {
    return new ImportContext(processedAt, zone, processedAt.atZone(zone).getYear());
  }
}
