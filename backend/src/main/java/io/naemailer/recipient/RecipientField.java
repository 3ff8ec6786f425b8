package io.naemailer.recipient;

/** The three recipient headers an event can override. */
public enum RecipientField {
  TO("email_to"),
  CC("email_cc"),
  BCC("email_bcc");

  private final String attributeName;

  RecipientField(String attributeName) {
    this.attributeName = attributeName;
  }

  /** Name used for extension attributes and payload keys, e.g. {@code email_to}. */
  public String attributeName() {
    return attributeName;
  }

  /** CloudEvents-legal first-class form, e.g. {@code emailto}. */
  public String routingName() {
    return routingNameOf(attributeName);
  }

  static String routingNameOf(String attributeName) {
    return attributeName.replace("_", "");
  }
}
