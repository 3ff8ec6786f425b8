package io.naemailer.content;

/** What the content selector produced for one event: rendered templates or a raw MIME message. */
public sealed interface MessageContent permits RenderedContent, RawMimeContent {

  String subject();
}
