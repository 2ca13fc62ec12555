package software.amazon.event.matcher;

final class Constants {

  private Constants() {
    throw new UnsupportedOperationException("You can't create instance of utility class.");
  }

  // keys of the match expressions understood by the JSON pattern compiler
  final static String EXISTS_MATCH = "exists";
  final static String PREFIX_MATCH = "prefix";
  final static String SHELLSTYLE_MATCH = "shellstyle";
  final static String WILDCARD = "wildcard";
  final static String EQUALS_IGNORE_CASE = "equals-ignore-case";
  final static String ANYTHING_BUT_MATCH = "anything-but";
  final static String REGEXP = "regexp";
}
