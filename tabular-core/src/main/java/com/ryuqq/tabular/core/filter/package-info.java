/**
 * Row filters and where-clause rendering/parsing.
 *
 * @since 1.0.0
 * @author Tabular Team
 */
package com.ryuqq.tabular.core.filter;
