package com.timeclock.model;

/**
 * Смысловая классификация отметки (приход, уход, перерыв, сверхурочные).
 */
public enum AttendanceStatus {
  CHECK_IN(0, "Check-In"),
  CHECK_OUT(1, "Check-Out"),
  BREAK_OUT(2, "Break-Out"),
  BREAK_IN(3, "Break-In"),
  OT_IN(4, "OT-In"),
  OT_OUT(5, "OT-Out"),
  UNKNOWN(-1, "Unknown");

  private final int code;
  private final String label;

  AttendanceStatus(int code, String label) {
    this.code = code;
    this.label = label;
  }

  public int code() {
    return code;
  }

  public String label() {
    return label;
  }

  public static AttendanceStatus fromCode(int code) {
    for (AttendanceStatus status : values()) {
      if (status != UNKNOWN && status.code == code) {
        return status;
      }
    }
    return UNKNOWN;
  }
}
