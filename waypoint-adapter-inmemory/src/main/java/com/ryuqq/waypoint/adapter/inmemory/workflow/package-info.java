/**
 * 코드로 등록하는 워크플로우 정의 저장소.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
package com.ryuqq.waypoint.adapter.inmemory.workflow;
