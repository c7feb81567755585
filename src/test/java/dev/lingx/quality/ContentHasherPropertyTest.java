package dev.lingx.quality;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.StringLength;

/** Property-based tests for {@link ContentHasher#fingerprint} shape and sensitivity. */
class ContentHasherPropertyTest {

  @Property
  void fingerprintIsAlwaysSixteenLowercaseHex(@ForAll String source, @ForAll String target) {
    assertThat(ContentHasher.fingerprint(source, target)).matches("[0-9a-f]{16}");
  }

  @Property
  void fingerprintIsDeterministic(@ForAll String source, @ForAll String target) {
    assertThat(ContentHasher.fingerprint(source, target))
        .isEqualTo(ContentHasher.fingerprint(source, target));
  }

  @Property
  void appendingACharacterToTargetChangesFingerprint(
      @ForAll @AlphaChars @StringLength(max = 40) String source,
      @ForAll @AlphaChars @StringLength(max = 40) String target,
      @ForAll @AlphaChars char extra) {
    assertThat(ContentHasher.fingerprint(source, target + extra))
        .isNotEqualTo(ContentHasher.fingerprint(source, target));
  }

  @Property
  void differentSourcesWithoutDelimiterGiveDifferentFingerprints(
      @ForAll @AlphaChars @StringLength(max = 40) String first,
      @ForAll @AlphaChars @StringLength(max = 40) String second,
      @ForAll @AlphaChars @StringLength(max = 40) String target) {
    Assume.that(!first.equals(second));

    assertThat(ContentHasher.fingerprint(first, target))
        .isNotEqualTo(ContentHasher.fingerprint(second, target));
  }
}
