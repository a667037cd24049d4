package com.quickdeploy.back.deploy.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndexResponse {
    /** Repository the deploy button points at, if one was requested */
    private String buttonNwo;
}
