package com.faceregistry.dto;

import com.faceregistry.entity.Identity;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class IdentityMatch {

    private Identity identity;
    private double score;
}
