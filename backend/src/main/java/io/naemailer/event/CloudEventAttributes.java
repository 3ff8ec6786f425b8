package io.naemailer.event;

import java.util.Set;

/** CloudEvents attribute names the bridge treats specially. */
public final class CloudEventAttributes {

  public static final String ID = "id";
  public static final String SOURCE = "source";
  public static final String TYPE = "type";
  public static final String SPECVERSION = "specversion";
  public static final String SUBJECT = "subject";
  public static final String TIME = "time";
  public static final String DATASCHEMA = "dataschema";
  public static final String DATACONTENTTYPE = "datacontenttype";
  public static final String DATA = "data";
  public static final String DATA_BASE64 = "data_base64";

  /** Attributes defined by the CloudEvents specification itself; never extensions. */
  public static final Set<String> RESERVED =
      Set.of(ID, SOURCE, TYPE, SPECVERSION, SUBJECT, TIME, DATASCHEMA, DATACONTENTTYPE, DATA);

  /**
   * Recipient hints promoted to first-class routing attributes. These use the compact lowercase
   * form that CloudEvents allows for attribute names.
   */
  public static final Set<String> ROUTING = Set.of("emailto", "emailcc", "emailbcc");

  public static final Set<String> SUPPORTED_SPEC_VERSIONS = Set.of("1.0", "0.3");

  private CloudEventAttributes() {}

  public static boolean isReserved(String name) {
    return RESERVED.contains(name);
  }
}
