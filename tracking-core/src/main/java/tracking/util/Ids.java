package tracking.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation. All engine-assigned ids are monotonic ULIDs, so lexical order
 * follows creation order within a JVM.
 */
public final class Ids {

  private Ids() {}

  public static String newId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
