package ca.gc.cra.subhunt.application.extract;

import ca.gc.cra.subhunt.domain.json.JsonTree;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * <strong>What:</strong> Schema-free extraction of hostname candidates and pagination cursors from JSON.
 * <p><strong>Why:</strong> Upstream lookup APIs change shape without notice; walking well-known keys keeps
 * discovery working across response variants.</p>
 * <p><strong>Role:</strong> Application service shared by every JSON-speaking candidate source.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Yield string values of candidate keys, then descend into container keys, then into every other
 *       nested object or array.</li>
 *   <li>Locate the first non-empty pagination cursor, depth-first.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 * <p><strong>Performance:</strong> Candidate streams are lazy and walk the tree with an explicit stack, so
 * document depth is bounded only by the parser's nesting limit.</p>
 *
 * @implNote The walk over-approximates on purpose: unrelated strings reach the caller and are discarded by
 * the scope filter.
 * @since 0.1.0
 */
public final class HeuristicExtractor {
  /** Keys whose string values are taken as hostnames. */
  public static final List<String> DEFAULT_CANDIDATE_KEYS =
      List.of("domain", "subdomain", "fqdn", "name", "host");
  /** Keys whose values are searched first for further candidates. */
  public static final List<String> DEFAULT_CONTAINER_KEYS =
      List.of("subdomains", "results", "data", "items");
  /** Keys that may carry the next-page token. */
  public static final List<String> DEFAULT_CURSOR_KEYS =
      List.of("page_state", "next_page_state", "next", "cursor");

  private final List<String> candidateKeys;
  private final List<String> containerKeys;
  private final List<String> cursorKeys;

  /**
   * Creates an extractor using the default key lists.
   */
  public HeuristicExtractor() {
    this(DEFAULT_CANDIDATE_KEYS, DEFAULT_CONTAINER_KEYS, DEFAULT_CURSOR_KEYS);
  }

  /**
   * Creates an extractor with custom key lists, searched in list order.
   *
   * @param candidateKeys keys holding hostname strings
   * @param containerKeys keys holding nested candidate collections
   * @param cursorKeys keys holding pagination tokens
   */
  public HeuristicExtractor(List<String> candidateKeys, List<String> containerKeys, List<String> cursorKeys) {
    this.candidateKeys = List.copyOf(Objects.requireNonNull(candidateKeys, "candidateKeys"));
    this.containerKeys = List.copyOf(Objects.requireNonNull(containerKeys, "containerKeys"));
    this.cursorKeys = List.copyOf(Objects.requireNonNull(cursorKeys, "cursorKeys"));
  }

  /**
   * Lazily yields raw candidate strings in document order.
   *
   * @param node parsed document or sub-tree
   * @return stream of candidates; may contain duplicates and out-of-scope noise
   */
  public Stream<String> extractCandidates(JsonTree node) {
    if (node == null) {
      return Stream.empty();
    }
    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(new CandidateWalk(node), Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Finds the first non-empty pagination cursor, checking the current object before its children.
   *
   * @param node parsed document or sub-tree
   * @return cursor when present
   */
  public Optional<String> extractCursor(JsonTree node) {
    Deque<JsonTree> pending = new ArrayDeque<>();
    if (node != null) {
      pending.push(node);
    }
    while (!pending.isEmpty()) {
      JsonTree current = pending.pop();
      List<JsonTree> children;
      if (current instanceof JsonTree.Mapping mapping) {
        for (String key : cursorKeys) {
          JsonTree value = mapping.get(key);
          if (value instanceof JsonTree.Text text && !text.value().isBlank()) {
            return Optional.of(text.value());
          }
        }
        children = List.copyOf(mapping.fields().values());
      } else if (current instanceof JsonTree.Sequence sequence) {
        children = sequence.elements();
      } else {
        continue;
      }
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.push(children.get(i));
      }
    }
    return Optional.empty();
  }

  /**
   * Orders the children of an object: candidate-key strings, then container-key values, then every other
   * nested object or array.
   */
  private List<Object> expand(JsonTree.Mapping mapping) {
    List<Object> items = new ArrayList<>();
    for (String key : candidateKeys) {
      if (mapping.get(key) instanceof JsonTree.Text text) {
        String value = text.value().trim();
        if (!value.isEmpty()) {
          items.add(value);
        }
      }
    }
    for (String key : containerKeys) {
      JsonTree value = mapping.get(key);
      if (isStructuredOrText(value)) {
        items.add(value);
      }
    }
    for (Map.Entry<String, JsonTree> entry : mapping.fields().entrySet()) {
      JsonTree value = entry.getValue();
      if (!containerKeys.contains(entry.getKey())
          && (value instanceof JsonTree.Sequence || value instanceof JsonTree.Mapping)) {
        items.add(value);
      }
    }
    return items;
  }

  private static boolean isStructuredOrText(JsonTree value) {
    return value instanceof JsonTree.Text
        || value instanceof JsonTree.Sequence
        || value instanceof JsonTree.Mapping;
  }

  /** Depth-first walk over an explicit stack; pending items are candidate strings or unexpanded nodes. */
  private final class CandidateWalk implements Iterator<String> {
    private final Deque<Object> pending = new ArrayDeque<>();
    private String next;

    private CandidateWalk(JsonTree root) {
      pending.push(root);
    }

    @Override
    public boolean hasNext() {
      while (next == null && !pending.isEmpty()) {
        Object item = pending.pop();
        if (item instanceof String candidate) {
          next = candidate;
        } else if (item instanceof JsonTree.Text text) {
          next = text.value();
        } else if (item instanceof JsonTree.Sequence sequence) {
          pushAll(sequence.elements());
        } else if (item instanceof JsonTree.Mapping mapping) {
          pushAll(expand(mapping));
        }
      }
      return next != null;
    }

    @Override
    public String next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      String result = next;
      next = null;
      return result;
    }

    private void pushAll(List<?> items) {
      for (int i = items.size() - 1; i >= 0; i--) {
        pending.push(items.get(i));
      }
    }
  }
}
