package com.sitepulse.scribe.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScribeRequestTest {

    @Test
    void documentBytesAreSharedWithTheCaller() {
        byte[] upload = {37, 80, 68, 70};

        ScribeRequest request = ScribeRequest.builder().document(upload).build();

        assertThat(request.getDocument()).isSameAs(upload);
        assertThat(request.hasDocument()).isTrue();
    }

    @Test
    void requestWithoutFilePartHasNoDocument() {
        assertThat(ScribeRequest.builder().formText("Crew 4").build().hasDocument()).isFalse();
    }
}
