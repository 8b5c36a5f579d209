package com.netcourier.docstruct.model;

import jakarta.validation.constraints.NotBlank;

public record ExtractTextRequest(String documentId,
                                 @NotBlank String text) {
}
