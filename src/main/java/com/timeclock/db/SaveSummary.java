package com.timeclock.db;

/**
 * Итог одного сохранения пачки записей.
 * <p>
 * inserted — реально записанные строки; duplicates — строки, проигнорированные
 * ограничением уникальности; skipped — записи, отброшенные до хранилища
 * (например, без user_id); errors — строки из пачек, которые не удалось записать.
 */
public final class SaveSummary {

  private static final SaveSummary EMPTY = new SaveSummary(0, 0, 0, 0);

  private final int inserted;
  private final int duplicates;
  private final int skipped;
  private final int errors;

  public SaveSummary(int inserted, int duplicates, int skipped, int errors) {
    this.inserted = inserted;
    this.duplicates = duplicates;
    this.skipped = skipped;
    this.errors = errors;
  }

  public static SaveSummary empty() {
    return EMPTY;
  }

  public int getInserted() {
    return inserted;
  }

  public int getDuplicates() {
    return duplicates;
  }

  public int getSkipped() {
    return skipped;
  }

  public int getErrors() {
    return errors;
  }

  public SaveSummary withSkipped(int skippedCount) {
    return new SaveSummary(inserted, duplicates, skippedCount, errors);
  }

  public SaveSummary plus(SaveSummary other) {
    return new SaveSummary(
        inserted + other.inserted,
        duplicates + other.duplicates,
        skipped + other.skipped,
        errors + other.errors);
  }

  @Override
  public String toString() {
    return "новых: " + inserted + ", дубликатов: " + duplicates + ", пропущено: " + skipped + ", ошибок: " + errors;
  }
}
