/**
 * REST controllers under {@code /api/v1}.
 */
package com.phillippitts.wfmparity.presentation.controller;
