package com.github.rmannibucau.asciidoctor.adf.client;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class AtlassianUser {

    private final String accountId;

    private final String displayName;
}
