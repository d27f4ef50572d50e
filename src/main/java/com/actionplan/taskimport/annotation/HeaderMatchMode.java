package com.actionplan.taskimport.annotation;

/**
 * How a header synonym is compared with a raw header. Both sides are compared after trimming,
 * lower-casing and removing whitespace.
 */
public enum HeaderMatchMode {

  /** The header must equal the synonym ("PO" but not "Techmac Responsable"). */
  EXACT,

  /** The header must contain the synonym ("Techmac Resp" for "resp"). */
  CONTAINS,

  /** The header must start with the synonym. */
  STARTS_WITH
}
