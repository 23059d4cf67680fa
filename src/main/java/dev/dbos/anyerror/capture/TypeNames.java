package dev.dbos.anyerror.capture;

import java.util.List;

/**
 * Produces the type labels stored in snapshots.
 *
 * <ul>
 *   <li>Platform types ({@code java.}, {@code javax.}, {@code jdk.}, {@code sun.}) are shortened to
 *       their simple name, e.g. {@code java.io.FileNotFoundException} becomes {@code
 *       FileNotFoundException}.
 *   <li>Application types keep their canonical name, so nested classes read {@code
 *       com.acme.Db.RowNotFound} rather than {@code com.acme.Db$RowNotFound}.
 *   <li>Anonymous, local and hidden classes have no canonical name and fall back to {@link
 *       Class#getName()}.
 *   <li>Arrays render as the standardized component name followed by {@code []}.
 * </ul>
 */
public final class TypeNames {

  private static final List<String> PLATFORM_PREFIXES = List.of("java.", "javax.", "jdk.", "sun.");

  private TypeNames() {}

  public static String standardizedName(Class<?> type) {
    if (type.isArray()) {
      return standardizedName(type.getComponentType()) + "[]";
    }
    if (type.isPrimitive()) {
      return type.getName();
    }

    String canonical = type.getCanonicalName();
    if (canonical == null) {
      return type.getName();
    }

    if (isPlatformType(canonical)) {
      String packageName = type.getPackageName();
      return packageName.isEmpty() ? canonical : canonical.substring(packageName.length() + 1);
    }
    return canonical;
  }

  /** Standardized name of the runtime class of {@code value}. */
  public static String standardizedNameOf(Object value) {
    return standardizedName(value.getClass());
  }

  private static boolean isPlatformType(String canonicalName) {
    for (String prefix : PLATFORM_PREFIXES) {
      if (canonicalName.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}
