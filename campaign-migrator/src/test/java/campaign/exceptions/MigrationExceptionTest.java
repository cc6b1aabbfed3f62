package campaign.exceptions;

import campaign.engine.MigrationStage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrationException")
class MigrationExceptionTest {

    @Nested
    @DisplayName("constructor with message only")
    class ConstructorWithMessageOnly {

        @Test
        @DisplayName("should store message")
        void shouldStoreMessage() {
            MigrationException ex = new MigrationException("Migration failed");

            assertThat(ex.getMessage()).isEqualTo("Migration failed");
            assertThat(ex.getBareMessage()).isEqualTo("Migration failed");
        }

        @Test
        @DisplayName("should have null diagnostic fields")
        void shouldHaveNullDiagnosticFields() {
            MigrationException ex = new MigrationException("Error");

            assertThat(ex.getStage()).isNull();
            assertThat(ex.getPlatform()).isNull();
            assertThat(ex.getRecordRef()).isNull();
            assertThat(ex.getCause()).isNull();
        }
    }

    @Nested
    @DisplayName("constructor with full context")
    class ConstructorWithFullContext {

        @Test
        @DisplayName("should append diagnostics to the message")
        void shouldAppendDiagnostics() {
            RuntimeException cause = new RuntimeException("Root cause");

            MigrationException ex = new MigrationException("Mapping failed",
                    MigrationStage.MAPPING, "facebook", "fb_123", cause);

            assertThat(ex.getMessage())
                    .isEqualTo("Mapping failed [stage=MAPPING] [platform=facebook] [record=fb_123]");
            assertThat(ex.getBareMessage()).isEqualTo("Mapping failed");
            assertThat(ex.getCause()).isSameAs(cause);
        }
    }

    @Nested
    @DisplayName("subclasses")
    class Subclasses {

        @Test
        @DisplayName("fetch failures should belong to the fetching stage")
        void fetchFailuresShouldBelongToFetching() {
            FetchException ex = new FetchException("timeout", "twitter", "tw_1");

            assertThat(ex).isInstanceOf(MigrationException.class);
            assertThat(ex.getStage()).isEqualTo(MigrationStage.FETCHING);
            assertThat(ex.getPlatform()).isEqualTo("twitter");
            assertThat(ex.getRecordRef()).isEqualTo("tw_1");
        }

        @Test
        @DisplayName("upload rejections should keep a copy of the rejected fields")
        void uploadRejectionsShouldCopyFields() {
            List<String> fields = new ArrayList<>(List.of("cpc_bid"));

            UploadRejectedException ex = new UploadRejectedException("Missing required fields", fields);
            fields.add("name");

            assertThat(ex.getStage()).isEqualTo(MigrationStage.UPLOADING);
            assertThat(ex.getRejectedFields()).containsExactly("cpc_bid");
        }

        @Test
        @DisplayName("unsupported platforms should be unchecked")
        void unsupportedPlatformsShouldBeUnchecked() {
            AdapterNotFoundException ex = new AdapterNotFoundException("myspace");

            assertThat(ex).isInstanceOf(RuntimeException.class);
            assertThat(ex.getMessage()).isEqualTo("Migration from 'myspace' is not supported");
            assertThat(ex.getPlatform()).isEqualTo("myspace");
        }
    }
}
