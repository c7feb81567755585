package dev.lingx.context;

/** Review state of a single translation. */
public enum ApprovalStatus {
  PENDING,
  APPROVED,
  REJECTED
}
