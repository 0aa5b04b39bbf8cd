package com.example.captionbot_backend.service.metadata;

import com.example.captionbot_backend.config.CaptionProperties;
import com.example.captionbot_backend.engine.YtDlpClient;
import com.example.captionbot_backend.engine.YtDlpException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class YtDlpMetadataProviderTest {

    @Mock
    private YtDlpClient ytDlp;

    @Test
    void usesUploaderThenChannel() throws Exception {
        ObjectMapper om = new ObjectMapper();
        when(ytDlp.dumpJson(eq("abc"), eq(List.of()), any()))
                .thenReturn(om.readTree("{\"title\": \"T\", \"uploader\": \"U\", \"channel\": \"C\"}"));
        when(ytDlp.dumpJson(eq("def"), eq(List.of()), any()))
                .thenReturn(om.readTree("{\"title\": \"T2\", \"channel\": \"C2\"}"));
        YtDlpMetadataProvider provider = new YtDlpMetadataProvider(ytDlp, new CaptionProperties());

        assertThat(provider.resolve("abc")).contains(new MetadataResult("abc", "T", "U"));
        assertThat(provider.resolve("def")).contains(new MetadataResult("def", "T2", "C2"));
    }

    @Test
    void toolFailureBecomesAccessException() throws Exception {
        when(ytDlp.dumpJson(eq("abc"), eq(List.of()), any()))
                .thenThrow(new YtDlpException(YtDlpException.Reason.AUTH_WALL, "cookies needed"));
        YtDlpMetadataProvider provider = new YtDlpMetadataProvider(ytDlp, new CaptionProperties());

        MetadataAccessException ex = assertThrows(MetadataAccessException.class, () -> provider.resolve("abc"));
        assertThat(ex.getMessage()).contains("AUTH_WALL");
    }
}
