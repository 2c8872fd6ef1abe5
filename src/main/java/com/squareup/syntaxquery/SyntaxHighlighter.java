package com.squareup.syntaxquery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 *   The entry point of the highlighter, invoked by the editor's event loop on
 *   every change to the command buffer. Each invocation parses the buffer,
 *   applies the {@link RuleSet}, and replaces this highlighter's namespace in the
 *   {@link HighlightRenderer} with the resolved spans.
 * </p>
 *
 * <p>
 *   The previous parse is reused when it was complete and the new buffer only
 *   appended whitespace to it; typing the space after a finished command does
 *   not rematch the whole tree.
 * </p>
 *
 * <p>
 *   This class is not threadsafe. It is meant to be owned by the single thread
 *   handling the editor's input, and every call runs to completion before the
 *   next one starts.
 * </p>
 *
 * @author <a href="mailto:gabor@squareup.com">Gabor Angeli</a>
 */
public class SyntaxHighlighter {

  /**
   * The Logger for this class
   */
  private static final Logger log = LoggerFactory.getLogger(SyntaxHighlighter.class);

  /** The parser turning the buffer into a token tree. */
  private final CommandParser parser;
  /** The rules we highlight with. */
  private final RuleSet rules;
  /** The renderer we paint onto. */
  private final HighlightRenderer renderer;
  /** Our namespace in {@link #renderer}. */
  private final int namespace;
  /** The listeners to notify on each reparse, in registration order. */
  private final List<BufferListener> listeners = new ArrayList<>();

  /** The buffer we last parsed, or null if we never parsed anything. */
  @Nullable private String previousBuffer = null;
  /** If true, {@link #previousBuffer} parsed as a complete command. */
  private boolean previousComplete = false;
  /** The token tree of {@link #previousBuffer}. */
  private List<Token> previousTokens = Collections.emptyList();
  /** The spans we last rendered. */
  private List<HighlightSpan> previousSpans = Collections.emptyList();

  /**
   * Create a highlighter.
   *
   * @param parser See {@link #parser}.
   * @param rules See {@link #rules}.
   * @param renderer See {@link #renderer}. A new namespace is allocated in it.
   */
  public SyntaxHighlighter(CommandParser parser, RuleSet rules, HighlightRenderer renderer) {
    this.parser = parser;
    this.rules = rules;
    this.renderer = renderer;
    this.namespace = renderer.newNamespace();
  }

  /**
   * Register a listener to be notified with the token tree after each reparse.
   *
   * @param listener The listener. It is removed once it returns true.
   */
  public void addBufferListener(BufferListener listener) {
    listeners.add(listener);
  }

  /**
   * Handle a change to the buffer: reparse and rehighlight it, unless the previous
   * result can be reused.
   *
   * @param buffer The new contents of the buffer.
   *
   * @return True if the buffer was reparsed and the highlights replaced.
   */
  public boolean onBufferChange(String buffer) {
    if (!needsReparse(buffer)) {
      return false;
    }
    ParseResult parse = parser.parse(buffer);
    if (log.isDebugEnabled()) {
      log.debug("Parsed {} buffer: {}", parse.complete ? "complete" : "incomplete",
          Token.debugString(parse.tokens, buffer));
    }
    this.previousBuffer = buffer;
    this.previousComplete = parse.complete;
    this.previousTokens = parse.tokens;

    this.previousSpans = HighlightResolver.resolve(rules, parse.tokens, buffer);
    HighlightResolver.render(previousSpans, renderer, namespace);
    notifyListeners(parse.tokens, buffer);
    return true;
  }

  /**
   * Compute the spans for a buffer from scratch, without touching the renderer
   * or the cached parse.
   *
   * @param buffer The buffer to highlight.
   *
   * @return The spans, in paint order.
   */
  public List<HighlightSpan> highlight(String buffer) {
    return HighlightResolver.resolve(rules, parser.parse(buffer).tokens, buffer);
  }

  /**
   * Check whether a buffer must be reparsed. We can skip the parse if the last
   * parse was complete, and the new buffer is the old buffer followed only by
   * whitespace.
   */
  boolean needsReparse(String buffer) {
    if (previousBuffer == null || !previousComplete || !buffer.startsWith(previousBuffer)) {
      return true;
    }
    for (int i = previousBuffer.length(); i < buffer.length(); ++i) {
      if (!Character.isWhitespace(buffer.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  /** Notify every listener of a reparse, dropping the ones that are done. */
  private void notifyListeners(List<Token> tokens, String buffer) {
    Iterator<BufferListener> iter = listeners.iterator();
    while (iter.hasNext()) {
      BufferListener listener = iter.next();
      if (listener.onReparse(tokens, buffer)) {
        log.debug("Removing buffer listener {}", listener);
        iter.remove();
      }
    }
  }

  /** @return The token tree of the last parse; empty if nothing was parsed yet. */
  public List<Token> currentTokens() {
    return previousTokens;
  }

  /** @return The buffer of the last parse, or null if nothing was parsed yet. */
  @Nullable public String currentBuffer() {
    return previousBuffer;
  }

  /** @return The spans rendered by the last reparse, in paint order. */
  public List<HighlightSpan> currentSpans() {
    return previousSpans;
  }

  /** @return The namespace this highlighter paints into. */
  public int namespace() {
    return namespace;
  }
}
