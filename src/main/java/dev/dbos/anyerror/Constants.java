package dev.dbos.anyerror;

public class Constants {

  public static final int DEFAULT_MAX_CAUSE_DEPTH = 32;
  // envelope payloads nest two objects per level; stays well under Jackson's nesting limit
  public static final int MAX_ALLOWED_CAUSE_DEPTH = 256;

  public static final String MAX_CAUSE_DEPTH_ENV_VAR = "ANYERROR_MAX_CAUSE_DEPTH";
  public static final String FORMAT_ENV_VAR = "ANYERROR_FORMAT";

  public static final String UNPARSEABLE_TYPE_LABEL = "unparseable";
}
