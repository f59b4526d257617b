package com.medreferral.messaging.http;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
public class MarkReadRequest {
    Set<String> ids;
}
