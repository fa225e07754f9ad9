package visconnect.protocol;

import visconnect.domain.AmpPhaseOptions;

import java.util.Objects;

/**
 * Which options a recompute request should use: the set carried in the
 * request, making the sender the options author, or whatever set the server
 * currently holds as authoritative.
 */
public sealed interface OptionsSelection permits OptionsSelection.UseProvided, OptionsSelection.UseAuthoritative {

    int TAG_PROVIDED = 1;
    int TAG_AUTHORITATIVE = 2;

    int tag();

    static OptionsSelection provided(AmpPhaseOptions options) {
        return new UseProvided(options);
    }

    static OptionsSelection authoritative() {
        return UseAuthoritative.INSTANCE;
    }

    record UseProvided(AmpPhaseOptions options) implements OptionsSelection {
        public UseProvided {
            Objects.requireNonNull(options, "options cannot be null");
        }

        @Override
        public int tag() {
            return TAG_PROVIDED;
        }
    }

    final class UseAuthoritative implements OptionsSelection {
        static final UseAuthoritative INSTANCE = new UseAuthoritative();

        private UseAuthoritative() {
        }

        @Override
        public int tag() {
            return TAG_AUTHORITATIVE;
        }

        @Override
        public String toString() {
            return "UseAuthoritative";
        }
    }
}
