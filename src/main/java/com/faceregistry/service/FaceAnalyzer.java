package com.faceregistry.service;

import com.faceregistry.dto.FaceAnalysis;
import com.faceregistry.exception.FaceAnalysisException;

/**
 * Boundary to the external face-analysis engine. May be slow; never called while registry state
 * is locked.
 */
public interface FaceAnalyzer {

    FaceAnalysis analyze(byte[] image) throws FaceAnalysisException;
}
